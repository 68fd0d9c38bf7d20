package model;

/**
 * Sorts a Function argument or result may have.
 */
public enum ValueSort {
    INTEGER("Int"),
    STRING("String"),
    FP64("FP"),
    TFU("TFU"),
    BOOLEAN("Bool");

    private final String typeTag;

    ValueSort(String typeTag) {
        this.typeTag = typeTag;
    }

    /**
     * Spelling used in quantifier binders, e.g. ((t Int)).
     */
    public String getTypeTag() {
        return typeTag;
    }

    public static ValueSort fromTypeTag(String tag) {
        for (ValueSort sort : values()) {
            if (sort.typeTag.equals(tag)) {
                return sort;
            }
        }
        return null;
    }
}
