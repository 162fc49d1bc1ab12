package alpha.chainrouter;

import alpha.chainrouter.handler.Chains;
import alpha.chainrouter.handler.Middleware;

/**
 * An API for proceeding the active processing chain.<p>
 * 
 * The chain is made up of {@link Middleware} composed into one unit by
 * {@link Chains#compose(java.util.List)}. Each middleware is given its own
 * chain object, and calling {@link #proceed()} executes the rest of the chain
 * before returning.<p>
 * 
 * The executing middleware can short-circuit the rest of the chain by
 * <i>not</i> calling {@code proceed()}. This is how a guard rejects a request:
 * it sets a status on the context and returns.<p>
 * 
 * Calling {@code proceed()} more than once is not an error; the rest of the
 * chain executes again, once for each call. The chain object of the last
 * middleware does nothing.<p>
 * 
 * The chain object is not thread-safe, and must only be called by the thread
 * running the middleware it was given to.
 */
@FunctionalInterface
public interface Chain
{
    /**
     * Calls the next middleware in the processing chain, if there is one.
     * 
     * @throws Exception
     *             as propagated from the rest of the chain
     */
    void proceed() throws Exception;
}
