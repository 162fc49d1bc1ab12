package alpha.chainrouter.handler;

import java.io.Serial;

/**
 * Thrown by a per-call handler when a new instance of the handler type could
 * not be created.
 * 
 * @see Handlers#perCall(Class, Member)
 */
public class HandlerInstantiationException extends RuntimeException
{
    @Serial
    private static final long serialVersionUID = 1L;
    
    /**
     * Constructs a {@code HandlerInstantiationException}.
     * 
     * @param message passed as-is to {@link Throwable#Throwable(String, Throwable)}
     * @param cause passed as-is to {@link Throwable#Throwable(String, Throwable)}
     */
    public HandlerInstantiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
