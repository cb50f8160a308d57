
package typesafeschwalbe.mmlc.compiler;

public class ErrorException extends Exception {

    public final Error error;

    public ErrorException(Error error) {
        super(error.toString());
        this.error = error;
    }

}
