package alpha.chainrouter;

import alpha.chainrouter.route.Router;

/**
 * The per-exchange state shared by all handlers of a dispatch.<p>
 * 
 * The context is owned by the surrounding server and merely borrowed by a
 * {@link Router} for the duration of one dispatch. It carries the request's
 * method and path, the current response status, and a capability to set a
 * redirect target which a subsequent response-writing stage acts on.<p>
 * 
 * The status doubles as the dispatch state. A context whose status is
 * {@value HttpConstants.StatusCode#FOUR_HUNDRED_FOUR} has not yet been
 * handled, and a router will only consult its routes for such a context. Any
 * other status means that an upstream stage has already produced a response.
 * <p>
 * 
 * The context is mutated in place. A handler should not retain a reference to
 * it beyond the dispatch.
 * 
 * @see DefaultContext
 */
public interface Context
{
    /**
     * Returns the request method, for example "GET".<p>
     * 
     * The method is matched case-sensitive and as-is against registered routes.
     * 
     * @return the request method (never {@code null})
     */
    String method();
    
    /**
     * Returns the request path, for example "/api/users".<p>
     * 
     * The path is matched as-is against registered routes; there is no
     * percent-decoding and no trailing-slash normalization.
     * 
     * @return the request path (never {@code null})
     */
    String path();
    
    /**
     * Returns the current response status.
     * 
     * @return the current response status
     */
    int status();
    
    /**
     * Sets the response status.
     * 
     * @param status new value
     */
    void status(int status);
    
    /**
     * Sets the target of a redirect response.<p>
     * 
     * This method does not set a status code. Most callers will also want to
     * set a 3XX (Redirection) status.
     * 
     * @param destination the redirect target
     * 
     * @throws NullPointerException if {@code destination} is {@code null}
     */
    void redirect(String destination);
}
