package org.exposql.model;

import java.util.List;

/**
 * Column identifying the measured unit: the person, or a group of a given type.
 */
public record EntityKey(String column) {
    public static final String PERSON_COLUMN = "person_id";
    private static final int MAX_GROUP_TYPE_INDEX = 4;

    public EntityKey {
        column = ModelDocuments.requireText(column, "column");
    }

    public static EntityKey person() {
        return new EntityKey(PERSON_COLUMN);
    }

    public static EntityKey group(final int groupTypeIndex) {
        if (groupTypeIndex < 0 || groupTypeIndex > MAX_GROUP_TYPE_INDEX) {
            throw new IllegalArgumentException("group type index must be between 0 and "
                    + MAX_GROUP_TYPE_INDEX + ": " + groupTypeIndex);
        }
        return new EntityKey("$group_" + groupTypeIndex);
    }

    public static EntityKey forGroupTypeIndex(final Integer groupTypeIndex) {
        return groupTypeIndex == null ? person() : group(groupTypeIndex);
    }

    public boolean isPerson() {
        return PERSON_COLUMN.equals(column);
    }

    public List<String> chain() {
        return List.of(column);
    }
}
