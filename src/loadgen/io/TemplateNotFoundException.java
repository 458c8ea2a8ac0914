package loadgen.io;

import java.io.IOException;

/**
 * Каталог шаблонов или файл шаблонов не найден.
 */
public class TemplateNotFoundException extends IOException {

    public TemplateNotFoundException(String message) {
        super(message);
    }
}
