
package typesafeschwalbe.mmlc.compiler;

import java.util.List;
import java.util.function.Function;

public class Result<T> {

    private final T value;
    private final List<Error> errors;

    private Result(T value, List<Error> errors) {
        this.value = value;
        this.errors = errors;
    }

    public static <T> Result<T> ofValue(T value) {
        if(value == null) {
            throw new IllegalArgumentException(
                "A 'Result' value may not be null!"
            );
        }
        return new Result<T>(value, null);
    }

    public static <T> Result<T> ofError(Error... errors) {
        return Result.ofError(List.of(errors));
    }

    public static <T> Result<T> ofError(List<Error> errors) {
        if(errors.isEmpty()) {
            throw new IllegalArgumentException(
                "A 'Result' error needs at least one error!"
            );
        }
        return new Result<T>(null, List.copyOf(errors));
    }

    public boolean isValue() {
        return this.value != null;
    }

    public T getValue() {
        if(this.value == null) {
            throw new IllegalStateException(
                "Attempted to get the value of a 'Result' without any value!"
            );
        }
        return this.value;
    }

    public boolean isError() {
        return this.errors != null;
    }

    public List<Error> getError() {
        if(this.errors == null) {
            throw new IllegalStateException(
                "Attempted to get the errors of a 'Result' without any errors!"
            );
        }
        return this.errors;
    }

    /**
     * Returns the value, or throws the first error if there is none.
     */
    public T orElseThrow() throws ErrorException {
        if(this.isError()) {
            throw new ErrorException(this.errors.get(0));
        }
        return this.value;
    }

    public <R> Result<R> map(Function<T, R> mapping) {
        if(this.isError()) {
            return Result.ofError(this.errors);
        }
        return Result.ofValue(mapping.apply(this.value));
    }

}
