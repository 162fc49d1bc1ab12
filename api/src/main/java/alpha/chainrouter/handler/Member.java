package alpha.chainrouter.handler;

import alpha.chainrouter.Chain;
import alpha.chainrouter.Context;

/**
 * An instance method of {@code T} with the middleware signature.<p>
 * 
 * Typically provided as an unbound method reference, for example
 * {@code AuthGuard::check}, given
 * 
 * <pre>{@code
 *   class AuthGuard {
 *       void check(Context ctx, Chain chain) throws Exception {
 *           ...
 *       }
 *   }
 * }</pre>
 * 
 * @param <T> the type declaring the method
 * 
 * @see Handlers#bound(Object, Member)
 * @see Handlers#perCall(Class, Member)
 */
@FunctionalInterface
public interface Member<T>
{
    /**
     * Invokes the method.
     * 
     * @param self the receiver
     * @param ctx the context
     * @param chain the rest of the chain
     * 
     * @throws Exception for any reason
     */
    void invoke(T self, Context ctx, Chain chain) throws Exception;
}
