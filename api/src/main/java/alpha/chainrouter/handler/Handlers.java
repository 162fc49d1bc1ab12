package alpha.chainrouter.handler;

import alpha.chainrouter.Chain;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.function.Supplier;

import static java.lang.System.Logger.Level.DEBUG;
import static java.util.Objects.requireNonNull;

/**
 * Normalizes all supported handler shapes into a {@link Middleware}.<p>
 * 
 * A handler either takes a {@link Chain} or it does not. The latter is an
 * {@link Endpoint}, which always proceeds the chain after returning. A handler
 * may also be an instance method, in which case the receiver is either given
 * upfront (<i>bound</i>) or created anew for each invocation
 * (<i>per-call</i>).
 * 
 * <table>
 *   <caption style="display:none">Handler shapes</caption>
 *   <tr><th>Shape</th>                        <th>Factory</th>                                            <th>Proceeds</th></tr>
 *   <tr><td>{@code (ctx, chain)}</td>          <td>{@link #middleware(Middleware)}</td>                    <td>if the handler calls {@code proceed()}</td></tr>
 *   <tr><td>{@code (ctx)}</td>                 <td>{@link #endpoint(Endpoint)}</td>                        <td>always</td></tr>
 *   <tr><td>{@code T::m(ctx, chain)}</td>      <td>{@link #bound(Object, Member)}</td>                     <td>if the method calls {@code proceed()}; never if the instance is {@code null}</td></tr>
 *   <tr><td>{@code T::m(ctx)}</td>             <td>{@link #boundEndpoint(Object, EndpointMember)}</td>     <td>always, also if the instance is {@code null}</td></tr>
 *   <tr><td>{@code T::m(ctx, chain)}</td>      <td>{@link #perCall(Class, Member)}</td>                    <td>if the method calls {@code proceed()}</td></tr>
 *   <tr><td>{@code T::m(ctx)}</td>             <td>{@link #perCallEndpoint(Class, EndpointMember)}</td>    <td>always</td></tr>
 * </table>
 * 
 * A lambda or a method reference to a method of an existing instance
 * ({@code guard::check}) is already a middleware or an endpoint and needs no
 * factory other than {@code endpoint()} for the endpoint.
 * 
 * <h2>Per-call handlers</h2>
 * 
 * A per-call handler creates a new instance of {@code T} for each invocation.
 * Any state kept in the instance is therefore lost when the invocation
 * returns. Only use per-call handlers for types that are stateless, or whose
 * state is meant to be exchange-scoped.
 */
public final class Handlers
{
    private static final System.Logger LOG
            = System.getLogger(Handlers.class.getPackageName());
    
    private Handlers() {
        // Empty
    }
    
    /**
     * Returns the given middleware as-is.<p>
     * 
     * This method exists for symmetry only.
     * 
     * @param handler middleware
     * 
     * @return the given middleware
     * 
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    public static Middleware middleware(Middleware handler) {
        return requireNonNull(handler);
    }
    
    /**
     * Returns a middleware that invokes the given endpoint and then proceeds
     * the chain.<p>
     * 
     * The chain is not proceeded if the endpoint returns exceptionally.
     * 
     * @param handler endpoint
     * 
     * @return a middleware
     * 
     * @throws NullPointerException if {@code handler} is {@code null}
     */
    public static Middleware endpoint(Endpoint handler) {
        requireNonNull(handler);
        return (ctx, chain) -> {
            handler.accept(ctx);
            chain.proceed();
        };
    }
    
    /**
     * Returns a middleware that invokes the given method on the given
     * instance.<p>
     * 
     * The chain object is passed as-is to the method, which decides whether to
     * proceed.<p>
     * 
     * The instance may be {@code null}, in which case the method is not invoked
     * and the chain does not proceed.
     * 
     * @param self instance (may be {@code null})
     * @param method to invoke
     * @param <T> type of instance
     * 
     * @return a middleware
     * 
     * @throws NullPointerException if {@code method} is {@code null}
     */
    public static <T> Middleware bound(T self, Member<T> method) {
        requireNonNull(method);
        return (ctx, chain) -> {
            if (self != null) {
                method.invoke(self, ctx, chain);
            } else {
                LOG.log(DEBUG, "Bound middleware has no instance, chain will not proceed.");
            }
        };
    }
    
    /**
     * Returns a middleware that invokes the given method on the given instance
     * and then proceeds the chain.<p>
     * 
     * The instance may be {@code null}, in which case the method is not
     * invoked, but the chain still proceeds.
     * 
     * @param self instance (may be {@code null})
     * @param method to invoke
     * @param <T> type of instance
     * 
     * @return a middleware
     * 
     * @throws NullPointerException if {@code method} is {@code null}
     */
    public static <T> Middleware boundEndpoint(T self, EndpointMember<T> method) {
        requireNonNull(method);
        return (ctx, chain) -> {
            if (self != null) {
                method.invoke(self, ctx);
            } else {
                LOG.log(DEBUG, "Bound endpoint has no instance, proceeding.");
            }
            chain.proceed();
        };
    }
    
    /**
     * Returns a middleware that invokes the given method on a new instance
     * created using the public or non-public no-arg constructor of the given
     * type.<p>
     * 
     * The constructor is looked up immediately, but invoked for each
     * invocation of the returned middleware. Please see the notes on per-call
     * handlers in the {@linkplain Handlers class JavaDoc}.
     * 
     * @param type of instance
     * @param method to invoke
     * @param <T> type of instance
     * 
     * @return a middleware
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code type} is abstract or has no no-arg constructor
     * 
     * @see HandlerInstantiationException
     */
    public static <T> Middleware perCall(Class<T> type, Member<T> method) {
        return perCall(noArgConstructor(type), method);
    }
    
    /**
     * Returns a middleware that invokes the given method on a new instance
     * retrieved from the given factory.<p>
     * 
     * The factory is called for each invocation of the returned middleware.
     * Please see the notes on per-call handlers in the
     * {@linkplain Handlers class JavaDoc}.
     * 
     * @param factory of instance
     * @param method to invoke
     * @param <T> type of instance
     * 
     * @return a middleware
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     */
    public static <T> Middleware perCall(Supplier<? extends T> factory, Member<T> method) {
        requireNonNull(factory);
        requireNonNull(method);
        return (ctx, chain) -> method.invoke(newInstance(factory), ctx, chain);
    }
    
    /**
     * Returns a middleware that invokes the given method on a new instance
     * created using the no-arg constructor of the given type, and then proceeds
     * the chain.
     * 
     * @param type of instance
     * @param method to invoke
     * @param <T> type of instance
     * 
     * @return a middleware
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * @throws IllegalArgumentException
     *             if {@code type} is abstract or has no no-arg constructor
     * 
     * @see #perCall(Class, Member)
     */
    public static <T> Middleware perCallEndpoint(Class<T> type, EndpointMember<T> method) {
        return perCallEndpoint(noArgConstructor(type), method);
    }
    
    /**
     * Returns a middleware that invokes the given method on a new instance
     * retrieved from the given factory, and then proceeds the chain.
     * 
     * @param factory of instance
     * @param method to invoke
     * @param <T> type of instance
     * 
     * @return a middleware
     * 
     * @throws NullPointerException
     *             if any argument is {@code null}
     * 
     * @see #perCall(Supplier, Member)
     */
    public static <T> Middleware perCallEndpoint(
            Supplier<? extends T> factory, EndpointMember<T> method)
    {
        requireNonNull(factory);
        requireNonNull(method);
        return (ctx, chain) -> {
            method.invoke(newInstance(factory), ctx);
            chain.proceed();
        };
    }
    
    /**
     * Returns the given handlers as an unmodifiable list, in the given order.
     * 
     * @param handlers to normalize
     * 
     * @return an unmodifiable list
     * 
     * @throws NullPointerException
     *             if {@code handlers} or an element therein is {@code null}
     */
    public static List<Middleware> normalize(Middleware... handlers) {
        return List.of(handlers);
    }
    
    private static <T> T newInstance(Supplier<? extends T> factory) {
        T self = factory.get();
        if (self == null) {
            throw new HandlerInstantiationException(
                    "Factory returned null.", null);
        }
        return self;
    }
    
    private static <T> Supplier<T> noArgConstructor(Class<T> type) {
        if (Modifier.isAbstract(type.getModifiers())) {
            throw new IllegalArgumentException(
                    "Can not instantiate abstract type: " + type.getName());
        }
        final Constructor<T> c;
        try {
            c = type.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(
                    "No no-arg constructor in " + type.getName(), e);
        }
        // A non-public constructor is usable unless the type's module does not
        // open its package, in which case instantiation fails per call
        c.trySetAccessible();
        return () -> {
            try {
                return c.newInstance();
            } catch (InvocationTargetException e) {
                throw new HandlerInstantiationException(
                        "Constructor of " + type.getName() + " threw an exception.",
                        e.getCause());
            } catch (ReflectiveOperationException e) {
                throw new HandlerInstantiationException(
                        "Failed to instantiate " + type.getName(), e);
            }
        };
    }
}
