package io.github.hide212131.langchain4j.agent.runtime.tool;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Active tools of one session, keyed by name. Registering a name again replaces the earlier tool. */
public final class ToolRegistry {

    private final Map<String, Tool<?, ?>> tools = new LinkedHashMap<>();

    public void register(Tool<?, ?> tool) {
        Objects.requireNonNull(tool, "tool");
        tools.remove(tool.name());
        tools.put(tool.name(), tool);
    }

    public void registerAll(List<? extends Tool<?, ?>> toRegister) {
        toRegister.forEach(this::register);
    }

    public Optional<Tool<?, ?>> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return tools.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(tools.keySet());
    }

    public Collection<Tool<?, ?>> tools() {
        return Collections.unmodifiableCollection(tools.values());
    }

    public int size() {
        return tools.size();
    }

    public void clear() {
        tools.clear();
    }
}
