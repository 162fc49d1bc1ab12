package alpha.chainrouter.core;

import alpha.chainrouter.Config;
import alpha.chainrouter.Context;
import alpha.chainrouter.handler.Chains;
import alpha.chainrouter.handler.Endpoint;
import alpha.chainrouter.handler.Handlers;
import alpha.chainrouter.handler.Middleware;
import alpha.chainrouter.route.RouteKey;
import alpha.chainrouter.route.Router;

import java.util.Optional;

import static alpha.chainrouter.HttpConstants.Method.DELETE;
import static alpha.chainrouter.HttpConstants.Method.GET;
import static alpha.chainrouter.HttpConstants.Method.HEAD;
import static alpha.chainrouter.HttpConstants.Method.POST;
import static alpha.chainrouter.HttpConstants.Method.PUT;
import static alpha.chainrouter.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * Default implementation of {@link Router}.<p>
 * 
 * Each registration normalizes and composes the given handlers once, and
 * stores the composed chain in a {@link RouteTable}, keyed by the router's
 * prefix at the time of registration. The dispatcher matches the full request
 * path against these keys, so a router with prefix "/api" which registered
 * "/users" serves a request for "/api/users".
 */
public final class DefaultRouter implements Router
{
    private static final System.Logger LOG
            = System.getLogger(DefaultRouter.class.getPackageName());
    
    private final Config config;
    private final RouteTable table;
    private volatile String prefix;
    
    /**
     * Constructs a {@code DefaultRouter}.
     * 
     * @param config of router
     * @param prefix of router
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public DefaultRouter(Config config, String prefix) {
        this.config = requireNonNull(config);
        this.prefix = requireNonNull(prefix);
        this.table  = new RouteTable(config.rejectDuplicateRoutes());
    }
    
    @Override
    public String prefix() {
        return prefix;
    }
    
    @Override
    public Router prefix(String prefix) {
        this.prefix = requireNonNull(prefix);
        return this;
    }
    
    @Override
    public Router get(String path, Middleware... handlers) {
        return add(GET, path, handlers);
    }
    
    @Override
    public Router post(String path, Middleware... handlers) {
        return add(POST, path, handlers);
    }
    
    @Override
    public Router put(String path, Middleware... handlers) {
        return add(PUT, path, handlers);
    }
    
    @Override
    public Router head(String path, Middleware... handlers) {
        return add(HEAD, path, handlers);
    }
    
    @Override
    public Router del(String path, Middleware... handlers) {
        return add(DELETE, path, handlers);
    }
    
    @Override
    public Router all(String path, Middleware... handlers) {
        requireNonNull(path);
        final Endpoint chain = compose(handlers);
        final String p = prefix;
        for (String m : config.methodsForAll()) {
            table.register(m, p, path, chain);
        }
        return this;
    }
    
    @Override
    public Router redirect(String path, String destination) {
        return redirect(path, destination, config.redirectStatus());
    }
    
    @Override
    public Router redirect(String path, String destination, int status) {
        requireNonNull(destination);
        return all(path, ctx -> {
            ctx.redirect(destination);
            ctx.status(status);
        });
    }
    
    @Override
    public Optional<Endpoint> lookup(String method, String path) {
        return table.lookup(method, prefix, path);
    }
    
    @Override
    public Endpoint routes() {
        return this::dispatch;
    }
    
    private Router add(String method, String path, Middleware... handlers) {
        requireNonNull(path);
        table.register(method, prefix, path, compose(handlers));
        return this;
    }
    
    private static Endpoint compose(Middleware... handlers) {
        var list = Handlers.normalize(handlers);
        if (list.isEmpty()) {
            throw new IllegalArgumentException("No handlers.");
        }
        return Chains.compose(list);
    }
    
    private void dispatch(Context ctx) throws Exception {
        final int status = ctx.status();
        if (status != FOUR_HUNDRED_FOUR) {
            LOG.log(DEBUG, () -> "Already handled (" + status + "), skipping: " +
                    ctx.method() + " " + ctx.path());
            return;
        }
        // The request path already carries the prefix of the route
        final String method = ctx.method(),
                     path   = ctx.path();
        var chain = table.lookup(method, "", path);
        if (chain.isEmpty()) {
            LOG.log(DEBUG, () -> "No route: " + RouteKey.of(method, "", path));
            return;
        }
        LOG.log(DEBUG, () -> "Matched route: " + RouteKey.of(method, "", path));
        chain.get().accept(ctx);
    }
    
    @Override
    public String toString() {
        return DefaultRouter.class.getSimpleName() + "{" +
                "prefix=" + prefix + ", " +
                "routes=" + table.keys().stream()
                                 .map(RouteKey::toString)
                                 .sorted()
                                 .collect(joining(", ", "[", "]")) + "}";
    }
}
