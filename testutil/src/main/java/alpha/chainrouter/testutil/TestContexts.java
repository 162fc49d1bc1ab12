package alpha.chainrouter.testutil;

import alpha.chainrouter.DefaultContext;

import static alpha.chainrouter.HttpConstants.Method.DELETE;
import static alpha.chainrouter.HttpConstants.Method.GET;
import static alpha.chainrouter.HttpConstants.Method.HEAD;
import static alpha.chainrouter.HttpConstants.Method.POST;
import static alpha.chainrouter.HttpConstants.Method.PUT;

/**
 * Factories of unhandled contexts.
 */
public final class TestContexts
{
    private TestContexts() {
        // Empty
    }
    
    /**
     * Returns a new context.
     * 
     * @param method of request
     * @param path of request
     * @return a new context
     */
    public static DefaultContext ctx(String method, String path) {
        return new DefaultContext(method, path);
    }
    
    /**
     * Returns a new {@code GET} context.
     * 
     * @param path of request
     * @return a new context
     */
    public static DefaultContext get(String path) {
        return ctx(GET, path);
    }
    
    /**
     * Returns a new {@code HEAD} context.
     * 
     * @param path of request
     * @return a new context
     */
    public static DefaultContext head(String path) {
        return ctx(HEAD, path);
    }
    
    /**
     * Returns a new {@code POST} context.
     * 
     * @param path of request
     * @return a new context
     */
    public static DefaultContext post(String path) {
        return ctx(POST, path);
    }
    
    /**
     * Returns a new {@code PUT} context.
     * 
     * @param path of request
     * @return a new context
     */
    public static DefaultContext put(String path) {
        return ctx(PUT, path);
    }
    
    /**
     * Returns a new {@code DELETE} context.
     * 
     * @param path of request
     * @return a new context
     */
    public static DefaultContext delete(String path) {
        return ctx(DELETE, path);
    }
}
