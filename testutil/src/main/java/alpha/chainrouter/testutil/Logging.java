package alpha.chainrouter.testutil;

import java.util.logging.Handler;
import java.util.logging.Logger;

import static alpha.chainrouter.testutil.LogRecords.toJUL;
import static java.lang.System.Logger.Level;

/**
 * Logging utilities.<p>
 * 
 * All methods target the JUL logger of the package that a given component
 * belongs to. The router's loggers are named after their package, and so a
 * component in a parent package will target the loggers of all sub packages.
 */
public final class Logging {
    private Logging() {
        // Empty
    }
    
    /**
     * Set logging level for the package of a given component.<p>
     * 
     * The returned logger must be strongly referenced for as long as the level
     * is expected to remain in effect, as the log manager only weakly
     * references its loggers.
     * 
     * @param component to extract package from
     * @param level to set
     * 
     * @return the logger
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static Logger setLevel(Class<?> component, Level level) {
        var l = Logger.getLogger(component.getPackageName());
        l.setLevel(toJUL(level));
        return l;
    }
    
    /**
     * Add handler to the logger of the package that the component belongs to.
     * 
     * @param component to extract package from
     * @param handler to add
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static void addHandler(Class<?> component, Handler handler) {
        Logger.getLogger(component.getPackageName()).addHandler(handler);
    }
    
    /**
     * Remove handler from the logger of the package that the component belongs
     * to.<p>
     * 
     * This method returns silently if the given handler is not found or
     * {@code null}.
     * 
     * @param component to extract package from
     * @param handler to remove (may be {@code null})
     * 
     * @throws NullPointerException if {@code component} is {@code null}
     */
    public static void removeHandler(Class<?> component, Handler handler) {
        Logger.getLogger(component.getPackageName()).removeHandler(handler);
    }
}
