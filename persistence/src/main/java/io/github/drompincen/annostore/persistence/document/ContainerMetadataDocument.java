package io.github.drompincen.annostore.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Document(collection = "container_metadata")
public class ContainerMetadataDocument {

    @Id
    private String id;
    @Indexed(unique = true)
    private String name;
    private String label;
    private Instant createdAt;
    private Instant modifiedAt;
    private boolean readOnlyForAnonymous;
    // stored as entries: field paths contain dots, which MongoDB map keys do not round-trip
    private List<FieldCount> fieldCounts = new ArrayList<>();

    public ContainerMetadataDocument() {}

    public static class FieldCount {
        private String field;
        private int count;

        public FieldCount() {}

        public FieldCount(String field, int count) {
            this.field = field;
            this.count = count;
        }

        public String getField() { return field; }
        public void setField(String field) { this.field = field; }

        public int getCount() { return count; }
        public void setCount(int count) { this.count = count; }
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getModifiedAt() { return modifiedAt; }
    public void setModifiedAt(Instant modifiedAt) { this.modifiedAt = modifiedAt; }

    public boolean isReadOnlyForAnonymous() { return readOnlyForAnonymous; }
    public void setReadOnlyForAnonymous(boolean readOnlyForAnonymous) { this.readOnlyForAnonymous = readOnlyForAnonymous; }

    public List<FieldCount> getFieldCounts() { return fieldCounts; }
    public void setFieldCounts(List<FieldCount> fieldCounts) { this.fieldCounts = fieldCounts; }

    public Map<String, Integer> fieldCountMap() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (fieldCounts != null) {
            fieldCounts.forEach(fc -> counts.put(fc.getField(), fc.getCount()));
        }
        return counts;
    }

    public void replaceFieldCounts(Map<String, Integer> counts) {
        List<FieldCount> entries = new ArrayList<>();
        counts.forEach((field, count) -> entries.add(new FieldCount(field, count)));
        this.fieldCounts = entries;
    }
}
