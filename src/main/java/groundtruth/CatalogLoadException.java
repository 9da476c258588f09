package groundtruth;

import java.io.IOException;

// A groundtruth or times file needed by the catalog is missing or unusable.
public class CatalogLoadException extends IOException {
    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
