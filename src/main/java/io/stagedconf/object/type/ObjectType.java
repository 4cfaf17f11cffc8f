package io.stagedconf.object.type;

/**
 * Kind of configuration object. Optional capabilities are exposed as separate interfaces
 * ({@link NameDecomposer}, {@link Registrable}) implemented by the concrete type.
 */
public interface ObjectType {

    String getName();

    /**
     * Plural name, used for directory naming.
     */
    String getPluralName();

    /**
     * @return the field id, or {@code -1} if the type has no such field
     */
    int getFieldId(String fieldName);

    FieldInfo getFieldInfo(int fieldId);

    int getFieldCount();
}
