package alpha.chainrouter.route;

import alpha.chainrouter.Config;
import alpha.chainrouter.Context;
import alpha.chainrouter.HttpConstants;
import alpha.chainrouter.Pipeline;
import alpha.chainrouter.handler.Endpoint;
import alpha.chainrouter.handler.Handlers;
import alpha.chainrouter.handler.Middleware;

import java.util.Optional;
import java.util.ServiceLoader;

import static java.util.stream.Collectors.toList;

/**
 * Maps a method and a path to a chain of handlers.<p>
 * 
 * For example:
 * 
 * <pre>{@code
 *   Router api = Router.create("/api")
 *           .get("/users", authGuard, listUsers)
 *           .post("/users", authGuard, createUser)
 *           .redirect("/people", "/api/users");
 * 
 *   // Mount in a pipeline
 *   new Pipeline().mount(api);
 * 
 *   // Or in the server's own pipeline
 *   Endpoint dispatcher = api.routes();
 * }</pre>
 * 
 * <h2>Registration</h2>
 * 
 * A route is registered using one of the method-specific methods
 * {@link #get(String, Middleware...) get()}, {@link #post(String, Middleware...) post()},
 * {@link #put(String, Middleware...) put()}, {@link #head(String, Middleware...) head()} and
 * {@link #del(String, Middleware...) del()}, or for many methods at once using
 * {@link #all(String, Middleware...) all()}.<p>
 * 
 * Each registration takes one or more handlers. The handlers are composed into
 * one chain, in the given order. The first handler decides whether to proceed
 * to the next, and so on. Other handler shapes, such as an {@link Endpoint}
 * or an instance method, are adapted using {@link Handlers}:
 * 
 * <pre>{@code
 *   router.get("/report",
 *           Handlers.endpoint(ctx -> audit(ctx)),
 *           Handlers.bound(guard, AuthGuard::check),
 *           Handlers.perCallEndpoint(ReportPage.class, ReportPage::render));
 * }</pre>
 * 
 * The route key is the literal concatenation of the method, "+", the router's
 * current prefix and the given path. The path is not validated, decoded or
 * normalized. "/users" and "/users/" are two different routes. A router with
 * prefix "/api" which registers "/users" serves requests for "/api/users".<p>
 * 
 * The first registration of a route wins. A subsequent registration of the
 * same route is ignored, unless the router is configured to
 * {@linkplain Config#rejectDuplicateRoutes() reject duplicates}.
 * 
 * <h2>Dispatch</h2>
 * 
 * The router's dispatcher is retrieved using {@link #routes()}. The dispatcher
 * will only look up a route for a context which is still unhandled; i.e. the
 * context's status is {@value HttpConstants.StatusCode#FOUR_HUNDRED_FOUR}. A
 * context with any other status is ignored. If no route is found, the
 * dispatcher returns normally and the context remains unhandled.<p>
 * 
 * Whatever exception a handler throws is not caught by the router; it
 * propagates to the caller of the dispatcher.
 * 
 * <h2>Thread safety</h2>
 * 
 * The router is designed to be fully configured first, and then serve
 * requests. The dispatcher can be invoked concurrently for many exchanges, but
 * must not be invoked concurrently with a registration or a change of the
 * prefix.
 */
public interface Router
{
    /**
     * Creates a new {@code Router} with no prefix and default configuration.
     * 
     * @return a new {@code Router}
     */
    static Router create() {
        return create(Config.DEFAULT, "");
    }
    
    /**
     * Creates a new {@code Router} with default configuration.
     * 
     * @param prefix of all routes registered
     * 
     * @return a new {@code Router}
     * 
     * @throws NullPointerException if {@code prefix} is {@code null}
     */
    static Router create(String prefix) {
        return create(Config.DEFAULT, prefix);
    }
    
    /**
     * Creates a new {@code Router}.
     * 
     * @param config of router
     * @param prefix of all routes registered
     * 
     * @return a new {@code Router}
     * 
     * @throws NullPointerException if an argument is {@code null}
     */
    static Router create(Config config, String prefix) {
        var loader = ServiceLoader.load(RouterFactory.class);
        var factories = loader.stream().collect(toList());
        if (factories.size() != 1) {
            throw new AssertionError(
                "Expected 1 factory, saw: " + factories.size());
        }
        return factories.get(0).get().create(config, prefix);
    }
    
    /**
     * Returns the current prefix.
     * 
     * @return the current prefix (never {@code null})
     */
    String prefix();
    
    /**
     * Sets the prefix.<p>
     * 
     * The new prefix applies to routes registered after this call, and to
     * subsequent calls to {@link #lookup(String, String)}. Routes already
     * registered keep the prefix they were registered with.
     * 
     * @param prefix new prefix
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException if {@code prefix} is {@code null}
     */
    Router prefix(String prefix);
    
    /**
     * Registers a route for the method GET.
     * 
     * @param path of route
     * @param handlers one or more, in order of execution
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     * @throws IllegalArgumentException
     *             if no handler is given
     * @throws RouteCollisionException
     *             if the route is already registered, and the router is
     *             configured to reject duplicates
     */
    Router get(String path, Middleware... handlers);
    
    /**
     * Registers a route for the method POST.
     * 
     * @param path of route
     * @param handlers one or more, in order of execution
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     * @throws IllegalArgumentException
     *             if no handler is given
     * @throws RouteCollisionException
     *             if the route is already registered, and the router is
     *             configured to reject duplicates
     */
    Router post(String path, Middleware... handlers);
    
    /**
     * Registers a route for the method PUT.
     * 
     * @param path of route
     * @param handlers one or more, in order of execution
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     * @throws IllegalArgumentException
     *             if no handler is given
     * @throws RouteCollisionException
     *             if the route is already registered, and the router is
     *             configured to reject duplicates
     */
    Router put(String path, Middleware... handlers);
    
    /**
     * Registers a route for the method HEAD.
     * 
     * @param path of route
     * @param handlers one or more, in order of execution
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     * @throws IllegalArgumentException
     *             if no handler is given
     * @throws RouteCollisionException
     *             if the route is already registered, and the router is
     *             configured to reject duplicates
     */
    Router head(String path, Middleware... handlers);
    
    /**
     * Registers a route for the method DELETE.
     * 
     * @param path of route
     * @param handlers one or more, in order of execution
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     * @throws IllegalArgumentException
     *             if no handler is given
     * @throws RouteCollisionException
     *             if the route is already registered, and the router is
     *             configured to reject duplicates
     */
    Router del(String path, Middleware... handlers);
    
    /**
     * Registers a route for each one of the {@link Config#methodsForAll()}.<p>
     * 
     * The handlers are composed once, and the same chain is registered for
     * each method. Each method is registered independently; a method already
     * registered for the path is ignored, but the others are still
     * registered.
     * 
     * @param path of route
     * @param handlers one or more, in order of execution
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument or array element is {@code null}
     * @throws IllegalArgumentException
     *             if no handler is given
     * @throws RouteCollisionException
     *             if a route is already registered, and the router is
     *             configured to reject duplicates
     */
    Router all(String path, Middleware... handlers);
    
    /**
     * Registers a route for the method GET.
     * 
     * @param path of route
     * @param handler the only handler
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     * @throws RouteCollisionException
     *             if the route is already registered, and the router is
     *             configured to reject duplicates
     */
    default Router get(String path, Endpoint handler) {
        return get(path, Handlers.endpoint(handler));
    }
    
    /**
     * Registers a route for the method POST.
     * 
     * @param path of route
     * @param handler the only handler
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     * @throws RouteCollisionException
     *             if the route is already registered, and the router is
     *             configured to reject duplicates
     */
    default Router post(String path, Endpoint handler) {
        return post(path, Handlers.endpoint(handler));
    }
    
    /**
     * Registers a route for the method PUT.
     * 
     * @param path of route
     * @param handler the only handler
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     * @throws RouteCollisionException
     *             if the route is already registered, and the router is
     *             configured to reject duplicates
     */
    default Router put(String path, Endpoint handler) {
        return put(path, Handlers.endpoint(handler));
    }
    
    /**
     * Registers a route for the method HEAD.
     * 
     * @param path of route
     * @param handler the only handler
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     * @throws RouteCollisionException
     *             if the route is already registered, and the router is
     *             configured to reject duplicates
     */
    default Router head(String path, Endpoint handler) {
        return head(path, Handlers.endpoint(handler));
    }
    
    /**
     * Registers a route for the method DELETE.
     * 
     * @param path of route
     * @param handler the only handler
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     * @throws RouteCollisionException
     *             if the route is already registered, and the router is
     *             configured to reject duplicates
     */
    default Router del(String path, Endpoint handler) {
        return del(path, Handlers.endpoint(handler));
    }
    
    /**
     * Registers a route for each one of the {@link Config#methodsForAll()}.
     * 
     * @param path of route
     * @param handler the only handler
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     * @throws RouteCollisionException
     *             if a route is already registered, and the router is
     *             configured to reject duplicates
     * 
     * @see #all(String, Middleware...)
     */
    default Router all(String path, Endpoint handler) {
        return all(path, Handlers.endpoint(handler));
    }
    
    /**
     * Registers a redirect for each one of the {@link Config#methodsForAll()}.
     * <p>
     * 
     * The status is {@link Config#redirectStatus()}, by default
     * {@value HttpConstants.StatusCode#THREE_HUNDRED_ONE}.
     * 
     * @param path of route
     * @param destination of redirect
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     * @throws RouteCollisionException
     *             if a route is already registered, and the router is
     *             configured to reject duplicates
     * 
     * @see #redirect(String, String, int)
     */
    Router redirect(String path, String destination);
    
    /**
     * Registers a redirect for each one of the {@link Config#methodsForAll()}.
     * <p>
     * 
     * The handler sets the {@linkplain Context#redirect(String) redirect target}
     * of the context to the given destination, and the status to the given
     * status. The status is not validated.
     * 
     * @param path of route
     * @param destination of redirect
     * @param status of response
     * 
     * @return this for chaining/fluency
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     * @throws RouteCollisionException
     *             if a route is already registered, and the router is
     *             configured to reject duplicates
     */
    Router redirect(String path, String destination, int status);
    
    /**
     * Looks up the chain registered for the given method and path, where the
     * path is relative to the current prefix.<p>
     * 
     * This method does not take the status of any context into account.
     * 
     * @param method of request
     * @param path of request
     * 
     * @return the chain, if found
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     */
    Optional<Endpoint> lookup(String method, String path);
    
    /**
     * Returns the dispatcher of this router.<p>
     * 
     * The dispatcher does nothing if the context is already handled.
     * Otherwise, it looks up the chain registered for the context's method and
     * path. The path is the full request path, which is expected to include
     * the prefix that the route was registered with. If found, the chain is
     * invoked. If not found, the dispatcher returns normally. The router's
     * prefix is applied only at registration, and is not prepended to the
     * request path at dispatch.<p>
     * 
     * The dispatcher is a live view of this router. Routes registered after
     * this method returns will be dispatched too.
     * 
     * @return the dispatcher of this router
     * 
     * @see Pipeline#mount(Router)
     */
    Endpoint routes();
}
