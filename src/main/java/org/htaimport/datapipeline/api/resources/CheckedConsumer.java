package org.htaimport.datapipeline.api.resources;

/**
 * A consumer that can throw checked exceptions.
 * <p>
 * Used by {@link org.htaimport.datapipeline.api.resources.source.ISourceReader#queryRange}
 * so that row callbacks may perform operations that throw checked exceptions while the
 * result set is being streamed.
 *
 * @param <T> the type of the input to the operation
 */
@FunctionalInterface
public interface CheckedConsumer<T> {

    /**
     * Performs this operation on the given argument.
     *
     * @param t the input argument
     * @throws Exception if the operation fails
     */
    void accept(T t) throws Exception;
}
