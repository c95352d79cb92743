package io.specdoc.render.document;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Numbering part of the document being assembled: abstract definitions and the instances bound to them.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class NumberingDefinitions {

    private final Map<Integer, AbstractNumbering> abstracts = new LinkedHashMap<>();
    private final Map<Integer, NumberingInstance> instances = new LinkedHashMap<>();

    public int nextAbstractId() {
        return abstracts.keySet().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
    }

    public int nextInstanceId() {
        return instances.keySet().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
    }

    public void add(AbstractNumbering definition) {
        if (abstracts.putIfAbsent(definition.id(), definition) != null) {
            throw new IllegalStateException("Abstract numbering " + definition.id() + " already registered");
        }
    }

    public void add(NumberingInstance instance) {
        if (!abstracts.containsKey(instance.abstractId())) {
            throw new IllegalStateException("Numbering instance " + instance.id()
                    + " refers to unknown abstract numbering " + instance.abstractId());
        }
        if (instances.putIfAbsent(instance.id(), instance) != null) {
            throw new IllegalStateException("Numbering instance " + instance.id() + " already registered");
        }
    }

    public Optional<NumberingInstance> instance(int instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    public Optional<AbstractNumbering> abstractFor(int instanceId) {
        return instance(instanceId).map(instance -> abstracts.get(instance.abstractId()));
    }

    /**
     * Moves every level of the definition behind {@code instanceId} by {@code delta}.
     *
     * @return false when no such instance exists
     */
    public boolean shiftIndentation(int instanceId, int delta) {
        NumberingInstance instance = instances.get(instanceId);
        if (instance == null) {
            return false;
        }
        abstracts.computeIfPresent(instance.abstractId(), (id, definition) -> definition.shifted(delta));
        return true;
    }

    public List<AbstractNumbering> abstracts() {
        return new ArrayList<>(abstracts.values());
    }

    public List<NumberingInstance> instances() {
        return new ArrayList<>(instances.values());
    }
}
