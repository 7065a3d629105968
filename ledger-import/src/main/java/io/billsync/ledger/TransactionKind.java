package io.billsync.ledger;

import java.util.Optional;

/**
 * The two ledger classifications that are imported. Anything else the provider writes in the
 * kind column (transfers, refunds marked as neutral, blanks) has no constant here.
 */
public enum TransactionKind {
    INCOME("收入"),
    EXPENSE("支出");

    private final String label;

    TransactionKind(String label) {
        this.label = label;
    }

    /** Label as it appears in the export and in the remote 收支 column. */
    public String label() { return label; }

    public static Optional<TransactionKind> fromLabel(String text) {
        for (TransactionKind k : values()) {
            if (k.label.equals(text)) return Optional.of(k);
        }
        return Optional.empty();
    }
}
