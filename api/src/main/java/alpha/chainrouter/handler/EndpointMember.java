package alpha.chainrouter.handler;

import alpha.chainrouter.Context;

/**
 * An instance method of {@code T} with the endpoint signature.
 * 
 * @param <T> the type declaring the method
 * 
 * @see Handlers#boundEndpoint(Object, EndpointMember)
 * @see Handlers#perCallEndpoint(Class, EndpointMember)
 */
@FunctionalInterface
public interface EndpointMember<T>
{
    /**
     * Invokes the method.
     * 
     * @param self the receiver
     * @param ctx the context
     * 
     * @throws Exception for any reason
     */
    void invoke(T self, Context ctx) throws Exception;
}
