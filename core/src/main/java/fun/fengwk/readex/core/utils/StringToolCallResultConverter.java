package fun.fengwk.readex.core.utils;

import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Passes tool results through as plain text instead of json.
 *
 * @author fengwk
 */
public class StringToolCallResultConverter implements ToolCallResultConverter {

    @Override
    public String convert(Object result, Type returnType) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence text) {
            return text.toString();
        }
        throw new IllegalStateException("unsupported tool result type: " + result.getClass().getName());
    }

}
