package fun.fengwk.readex.core.cli;

import org.apache.commons.lang3.StringUtils;

/**
 * Output formats of the file extraction command.
 *
 * @author fengwk
 */
public enum OutputFormat {

    HTML("html"),
    TEXT("text"),
    JSON("json");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static OutputFormat fromValue(String value) {
        if (StringUtils.isBlank(value)) {
            return HTML;
        }
        for (OutputFormat format : values()) {
            if (format.value.equalsIgnoreCase(value.trim())) {
                return format;
            }
        }
        throw new IllegalArgumentException("unsupported format: " + value);
    }

}
