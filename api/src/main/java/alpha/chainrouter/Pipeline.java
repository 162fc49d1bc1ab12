package alpha.chainrouter;

import alpha.chainrouter.handler.Chains;
import alpha.chainrouter.handler.Endpoint;
import alpha.chainrouter.handler.Handlers;
import alpha.chainrouter.handler.Middleware;
import alpha.chainrouter.route.Router;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An ordered sequence of middleware stages, in which routers are mounted.<p>
 * 
 * For example:
 * 
 * <pre>{@code
 *   Endpoint app = new Pipeline()
 *           .use(ctx -> accessLog.record(ctx.method(), ctx.path()))
 *           .mount(Router.create("/api").get("/users", listUsers))
 *           .mount(Router.create().redirect("/", "/api/users"))
 *           .handler();
 *   
 *   app.accept(context);
 * }</pre>
 * 
 * A mounted router always falls through to the next stage, and the next
 * router will only dispatch the context if it is still unhandled.<p>
 * 
 * This class is not thread-safe. The pipeline is expected to be built by one
 * thread. The endpoint returned from {@link #handler()} is thread-safe,
 * assuming the stages are.
 */
public final class Pipeline
{
    private final List<Middleware> stages;
    
    /**
     * Constructs an empty {@code Pipeline}.
     */
    public Pipeline() {
        stages = new ArrayList<>();
    }
    
    /**
     * Appends a middleware stage.
     * 
     * @param stage to append
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException if {@code stage} is {@code null}
     */
    public Pipeline use(Middleware stage) {
        stages.add(requireNonNull(stage));
        return this;
    }
    
    /**
     * Appends an endpoint stage.<p>
     * 
     * The pipeline always proceeds after the endpoint returns normally.
     * 
     * @param stage to append
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException if {@code stage} is {@code null}
     * 
     * @see Handlers#endpoint(Endpoint)
     */
    public Pipeline use(Endpoint stage) {
        return use(Handlers.endpoint(stage));
    }
    
    /**
     * Appends the dispatcher of the given router.<p>
     * 
     * Same as {@code use(router.routes())}.
     * 
     * @param router to mount
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException if {@code router} is {@code null}
     */
    public Pipeline mount(Router router) {
        return use(router.routes());
    }
    
    /**
     * Returns the number of stages.
     * 
     * @return the number of stages
     */
    public int size() {
        return stages.size();
    }
    
    /**
     * Composes the current stages into one endpoint.<p>
     * 
     * Stages added after this method returns are not reflected by the
     * returned endpoint.
     * 
     * @return an endpoint
     * 
     * @see Chains#compose(List)
     */
    public Endpoint handler() {
        return Chains.compose(stages);
    }
}
