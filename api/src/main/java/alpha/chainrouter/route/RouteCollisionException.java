package alpha.chainrouter.route;

import alpha.chainrouter.Config;

import java.io.Serial;

/**
 * Thrown by a {@link Router} when an attempt is made to register a route
 * which is already registered, and the router is configured to
 * {@linkplain Config#rejectDuplicateRoutes() reject duplicates}.
 */
public class RouteCollisionException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code RouteCollisionException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String)}
     */
    public RouteCollisionException(String message) {
        super(message);
    }
}
