package alpha.chainrouter.handler;

import alpha.chainrouter.Context;
import alpha.chainrouter.route.Router;

/**
 * A handler that has no say in the continuation of the chain.<p>
 * 
 * Used as a member of a chain, the endpoint always falls through; the next
 * handler executes as soon as the endpoint returns normally.<p>
 * 
 * This is also the shape of a composed chain ({@link Chains#compose(java.util.List)})
 * and of a router's dispatcher ({@link Router#routes()}). A router can
 * therefore be mounted as one stage in a larger pipeline, or in another router.
 */
@FunctionalInterface
public interface Endpoint
{
    /**
     * Handles the exchange.
     * 
     * @param ctx the context (never {@code null})
     * 
     * @throws Exception
     *             for any reason, propagated as-is to the dispatcher's caller
     */
    void accept(Context ctx) throws Exception;
    
    /**
     * Returns this endpoint as a middleware that proceeds after this endpoint
     * returns.
     * 
     * @return this endpoint as a middleware
     * 
     * @see Handlers#endpoint(Endpoint)
     */
    default Middleware asMiddleware() {
        return Handlers.endpoint(this);
    }
}
