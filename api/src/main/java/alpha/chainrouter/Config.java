package alpha.chainrouter;

import alpha.chainrouter.route.RouteCollisionException;
import alpha.chainrouter.route.Router;

import java.util.List;

/**
 * Router configuration.<p>
 * 
 * {@link Config#toBuilder()} allows for any configuration object to be used as
 * a template for a new instance.<p>
 * 
 * The static method {@link #configuration()} is a shortcut for
 * {@code Config.DEFAULT.toBuilder()}:
 * 
 * <pre>{@code
 *   Router api = Router.create(configuration()
 *           .redirectStatus(308)
 *           .build(), "/api");
 * }</pre>
 * 
 * The implementation is immutable.<p>
 * 
 * The implementation inherits the identity-based implementations of
 * {@link Object#hashCode()} and {@link Object#equals(Object)}.
 */
public interface Config
{
    /**
     * The configuration used by {@link Router#create()}.<p>
     * 
     * This instance contains the following values:<p>
     * 
     * Redirect status = 301<br>
     * Methods for all = DELETE, GET, HEAD, POST, PUT<br>
     * Reject duplicate routes = false
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * {@return the status code set by a redirect route, if not specified}<p>
     * 
     * The {@link #DEFAULT} configuration returns
     * {@value HttpConstants.StatusCode#THREE_HUNDRED_ONE}.
     * 
     * @see Router#redirect(String, String)
     */
    int redirectStatus();
    
    /**
     * {@return the methods a route registered with {@code all()} is
     * registered for}<p>
     * 
     * The {@link #DEFAULT} configuration returns DELETE, GET, HEAD, POST and
     * PUT, in that order.<p>
     * 
     * The returned list is unmodifiable.
     * 
     * @see Router#all(String, alpha.chainrouter.handler.Middleware...)
     */
    List<String> methodsForAll();
    
    /**
     * {@return whether registering a route that is already registered is an
     * error}<p>
     * 
     * By default, this method returns {@code false} and a duplicate
     * registration is ignored; the route registered first is retained.<p>
     * 
     * If {@code true}, the router will throw a
     * {@link RouteCollisionException} for a duplicate registration. Note that
     * with this option enabled, {@code all()} and {@code redirect()} fail if
     * any one of the {@link #methodsForAll()} is taken, but the methods
     * before it in the list remain registered.
     */
    boolean rejectDuplicateRoutes();
    
    /**
     * Returns a builder with all values set to the values of this config.
     * 
     * @return a builder with all values set to the values of this config
     */
    Builder toBuilder();
    
    /**
     * Is a shortcut for {@code DEFAULT.toBuilder()}.
     * 
     * @return a builder with all values set to their defaults
     */
    static Config.Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The builder is immutable. All setter methods return a new builder
     * instance representing the new state.
     */
    interface Builder {
        /**
         * Sets a new value.<p>
         * 
         * The value is not validated. It should be a status code from the 3XX
         * (Redirection) class.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#redirectStatus()
         */
        Builder redirectStatus(int newVal);
        
        /**
         * Sets a new value.<p>
         * 
         * The methods are registered in the given order.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * 
         * @throws NullPointerException
         *             if {@code newVal} or an element therein is {@code null}
         * @throws IllegalArgumentException
         *             if {@code newVal} is empty, or has an empty or repeated element
         * 
         * @see Config#methodsForAll()
         */
        Builder methodsForAll(String... newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#rejectDuplicateRoutes()
         */
        Builder rejectDuplicateRoutes(boolean newVal);
        
        /**
         * Builds a configuration object.
         * 
         * @return a new configuration object
         */
        Config build();
    }
}
