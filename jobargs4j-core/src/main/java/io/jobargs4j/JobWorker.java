package io.jobargs4j;

/**
 * A unit of work with an optional, typed argument schema.
 *
 * <p>Arguments are declared as a {@code record} nested in the worker under the name
 * {@code Args}. Workers without an {@code Args} record take no arguments.
 *
 * <pre>{@code
 * public class ResizeImageWorker implements JobWorker<ResizeImageWorker.Args> {
 *
 *     public record Args(long attachmentId, @Default("512") int width) {
 *     }
 *
 *     @Override
 *     public Object run(JobContext<Args> context) {
 *         long id = context.get("attachmentId");
 *         return resize(id, context.args().width());
 *     }
 * }
 * }</pre>
 *
 * @param <A> the nested {@code Args} record, or {@link Void} for argument-less work
 */
public interface JobWorker<A> {

    /**
     * Name used to route dispatched jobs back to this worker. Defaults to the simple class name.
     */
    default String name() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }

    /**
     * Work body. Reads its arguments through the supplied context.
     */
    default Object run(JobContext<A> context) throws Exception {
        throw new UnsupportedOperationException(name() + " must implement run method");
    }
}
