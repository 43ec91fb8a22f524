package com.galois.bmc.result;
import com.galois.bmc.ir.Property;

/**
 * The status of one property.
 */
public final class PropertyResult {
    private final Property property;
    private final PropertyStatus status;

    public PropertyResult(Property property, PropertyStatus status) {
        if (property == null) throw new NullPointerException("property");
        if (status == null) throw new NullPointerException("status");
        this.property = property;
        this.status = status;
    }

    public Property getProperty() {
        return property;
    }

    public String getId() {
        return property.getId();
    }

    public PropertyStatus getStatus() {
        return status;
    }

    public String toString() {
        return "Check " + property.getId() + ": " + status
            + " (" + property.getDescription() + ")";
    }

    public boolean equals(Object o) {
        if (!(o instanceof PropertyResult)) return false;
        PropertyResult r = (PropertyResult) o;
        return property.getId().equals(r.property.getId()) && status == r.status;
    }

    public int hashCode() {
        return property.getId().hashCode() * 31 + status.hashCode();
    }
}
