package fun.fengwk.rp.core.service.flow;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Variables shared between the steps of one browser workflow.
 *
 * <p>Steps receive the context explicitly; values are used to fill selector placeholders and to
 * carry extracted data from one step to the next.
 *
 * @author fengwk
 */
@Component
public class FlowContext {

    private final Map<String, Object> variables = new ConcurrentHashMap<>();

    public void put(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("variable name must not be null");
        }
        if (value == null) {
            variables.remove(key);
        } else {
            variables.put(key, value);
        }
    }

    public Object get(String key) {
        return key == null ? null : variables.get(key);
    }

    public String getString(String key) {
        Object value = get(key);
        return value == null ? "" : String.valueOf(value);
    }

    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public void clear() {
        variables.clear();
    }

}
