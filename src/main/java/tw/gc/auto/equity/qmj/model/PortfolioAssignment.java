package tw.gc.auto.equity.qmj.model;

import tw.gc.auto.equity.qmj.enums.Bucket;

public record PortfolioAssignment(String entityId, Period period, Bucket bucket) {
}
