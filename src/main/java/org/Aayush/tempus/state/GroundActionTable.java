package org.Aayush.tempus.state;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.Aayush.tempus.core.id.IDMapper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Arena of ground actions indexed by id, with lookup by signature.
 */
public final class GroundActionTable {
    private final ObjectArrayList<GroundAction> actions;
    private final IDMapper signatures;

    GroundActionTable(List<GroundAction> actions) {
        this.actions = new ObjectArrayList<>(actions);
        List<String> names = new ArrayList<>(actions.size());
        for (int id = 0; id < actions.size(); id++) {
            GroundAction action = actions.get(id);
            if (action.getId() != id) {
                throw new IllegalArgumentException("ground action " + action + " has id " + action.getId() + ", expected " + id);
            }
            names.add(action.signature());
        }
        this.signatures = IDMapper.createImmutable(names);
    }

    public GroundAction get(int id) {
        return actions.get(id);
    }

    public int size() {
        return actions.size();
    }

    public List<GroundAction> all() {
        return Collections.unmodifiableList(actions);
    }

    /**
     * Finds an instance by signature, for example {@code (pick-up robot1 package1 depot)}.
     */
    public Optional<GroundAction> find(String signature) {
        int id = signatures.indexOf(signature);
        return id == IDMapper.NOT_FOUND ? Optional.empty() : Optional.of(actions.get(id));
    }

    /**
     * All instances of one lifted action, in id order.
     */
    public List<GroundAction> instancesOf(String actionName) {
        List<GroundAction> instances = new ArrayList<>();
        for (GroundAction action : actions) {
            if (action.getName().equals(actionName)) {
                instances.add(action);
            }
        }
        return instances;
    }
}
