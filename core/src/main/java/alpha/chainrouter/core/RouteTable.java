package alpha.chainrouter.core;

import alpha.chainrouter.handler.Endpoint;
import alpha.chainrouter.route.RouteCollisionException;
import alpha.chainrouter.route.RouteKey;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.lang.System.Logger.Level.DEBUG;
import static java.text.MessageFormat.format;

/**
 * The dispatch table of a router.<p>
 * 
 * Maps a {@link RouteKey} to the composed chain of the route. An entry is
 * never replaced nor removed. The first registration of a key wins, and a
 * subsequent registration of the same key is either ignored or rejected.<p>
 * 
 * Lookups may run concurrently with each other. The backing map is concurrent,
 * so a lookup concurrent with a registration will not corrupt the table, but
 * the router's contract does not allow it.
 */
final class RouteTable
{
    private static final System.Logger LOG
            = System.getLogger(RouteTable.class.getPackageName());
    
    private final ConcurrentMap<RouteKey, Endpoint> routes;
    private final boolean rejectDuplicates;
    
    RouteTable(boolean rejectDuplicates) {
        this.routes = new ConcurrentHashMap<>();
        this.rejectDuplicates = rejectDuplicates;
    }
    
    /**
     * Registers a route, if absent.
     * 
     * @param method of route
     * @param prefix of router
     * @param path of route
     * @param chain of route
     * 
     * @return {@code true} if registered, {@code false} if already present
     * 
     * @throws RouteCollisionException
     *             if already present, and duplicates are rejected
     */
    boolean register(String method, String prefix, String path, Endpoint chain) {
        var key = RouteKey.of(method, prefix, path);
        if (routes.putIfAbsent(key, chain) == null) {
            LOG.log(DEBUG, () -> "Registered route: " + key);
            return true;
        }
        if (rejectDuplicates) {
            throw new RouteCollisionException(format(
                    "Route \"{0}\" is already registered.", key));
        }
        LOG.log(DEBUG, () -> "Route already registered, ignoring: " + key);
        return false;
    }
    
    /**
     * Looks up a route.
     * 
     * @param method of request
     * @param prefix of router
     * @param path of request
     * 
     * @return the chain, if found
     */
    Optional<Endpoint> lookup(String method, String prefix, String path) {
        return Optional.ofNullable(routes.get(RouteKey.of(method, prefix, path)));
    }
    
    /**
     * Returns a snapshot of all registered keys.
     * 
     * @return a snapshot of all registered keys
     */
    Set<RouteKey> keys() {
        return Set.copyOf(routes.keySet());
    }
}
