package tw.gc.auto.equity.qmj.enums;

import java.util.Comparator;

/**
 * Secondary ordering applied when two entities share the same Quality score.
 */
public enum TieBreakKey {
    ENTITY_ID_ASC(Comparator.naturalOrder()),
    ENTITY_ID_DESC(Comparator.reverseOrder());

    private final Comparator<String> entityOrder;

    TieBreakKey(Comparator<String> entityOrder) {
        this.entityOrder = entityOrder;
    }

    public Comparator<String> entityOrder() {
        return entityOrder;
    }
}
