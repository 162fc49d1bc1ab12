package alpha.chainrouter.examples;

import alpha.chainrouter.Chain;
import alpha.chainrouter.Context;
import alpha.chainrouter.DefaultContext;
import alpha.chainrouter.Pipeline;
import alpha.chainrouter.handler.Endpoint;
import alpha.chainrouter.handler.Handlers;
import alpha.chainrouter.route.Router;

import java.util.List;

import static alpha.chainrouter.HttpConstants.Method.DELETE;
import static alpha.chainrouter.HttpConstants.Method.GET;
import static alpha.chainrouter.HttpConstants.StatusCode.FOUR_HUNDRED_ONE;
import static alpha.chainrouter.HttpConstants.StatusCode.TWO_HUNDRED;
import static alpha.chainrouter.HttpConstants.StatusCode.TWO_HUNDRED_FOUR;

/**
 * Mounts two routers in a pipeline, one of which is guarded, and dispatches a
 * few exchanges.<p>
 * 
 * There is no server in this example. A real application would implement
 * {@link Context} on top of its server's request and response types, and call
 * the pipeline's endpoint once for each request.
 */
public class GuardedApi
{
    /**
     * Application entry point.
     * 
     * @param args ignored
     * 
     * @throws Exception if a handler throws
     */
    public static void main(String... args) throws Exception {
        Endpoint app = app();
        for (var ctx : List.of(
                new DefaultContext(GET, "/hello"),
                new DefaultContext(GET, "/hi"),
                new DefaultContext(DELETE, "/admin/cache"),
                new DefaultContext(GET, "/nothing-here")))
        {
            app.accept(ctx);
            System.out.println(ctx);
        }
    }
    
    /**
     * Builds the application's pipeline.
     * 
     * @return the application's pipeline
     */
    public static Endpoint app() {
        // Admin routes must pass the guard, which short-circuits by not proceeding
        Router admin = Router.create("/admin")
                .del("/cache",
                        Handlers.perCall(AdminGuard.class, AdminGuard::check),
                        Handlers.endpoint(ctx -> ctx.status(TWO_HUNDRED_FOUR)));
        
        // Public routes
        Endpoint hello = ctx -> ctx.status(TWO_HUNDRED);
        Router site = Router.create()
                .get("/hello", hello)
                .redirect("/hi", "/hello");
        
        return new Pipeline()
                .mount(admin)
                .mount(site)
                .handler();
    }
    
    /**
     * Rejects all requests.<p>
     * 
     * A new guard is created for each request.
     */
    public static final class AdminGuard {
        /**
         * Rejects the request.
         * 
         * @param ctx context
         * @param chain not proceeded
         */
        public void check(Context ctx, Chain chain) {
            // No credentials in this example
            ctx.status(FOUR_HUNDRED_ONE);
        }
    }
}
