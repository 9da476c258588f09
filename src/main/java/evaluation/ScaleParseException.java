package evaluation;

import java.io.IOException;

// A scale log exists but holds no usable scale.
public class ScaleParseException extends IOException {
    public ScaleParseException(String message) {
        super(message);
    }

    public ScaleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
