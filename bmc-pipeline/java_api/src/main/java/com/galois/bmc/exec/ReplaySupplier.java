package com.galois.bmc.exec;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.bmc.ConcreteValue;
import com.galois.bmc.Values;
import com.galois.bmc.ir.InjectionPoint;

/**
 * Supplies fixed values per injection point, in occurrence order.
 * Occurrences beyond the recorded ones, and points without an entry,
 * produce the zero value of the point's type.
 */
public final class ReplaySupplier implements NondetSupplier {
    private final Map<String, List<ConcreteValue>> table;

    public ReplaySupplier(Map<String, List<ConcreteValue>> table) {
        this.table = new LinkedHashMap<String, List<ConcreteValue>>();
        for (Map.Entry<String, List<ConcreteValue>> e : table.entrySet()) {
            this.table.put(e.getKey(), new ArrayList<ConcreteValue>(e.getValue()));
        }
    }

    /** A supplier that always produces zero values. */
    public static ReplaySupplier zeros() {
        return new ReplaySupplier(Collections.<String, List<ConcreteValue>>emptyMap());
    }

    public ConcreteValue next(InjectionPoint point, int occurrence) {
        List<ConcreteValue> values = table.get(point.getId());
        if (values == null || occurrence >= values.size()) {
            return Values.zero(point.type());
        }
        ConcreteValue v = values.get(occurrence);
        if (!v.type().equals(point.type())) {
            throw new IllegalArgumentException(
                String.format("Value %s for %s does not have type %s", v, point.getId(), point.type()));
        }
        return v;
    }
}
