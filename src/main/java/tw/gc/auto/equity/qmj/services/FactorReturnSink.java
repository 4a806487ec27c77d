package tw.gc.auto.equity.qmj.services;

import tw.gc.auto.equity.qmj.model.QmjRunResult;

/**
 * Receives the output of a completed run.
 */
public interface FactorReturnSink {

    /**
     * Replaces any previously published series with the run's series.
     */
    void publish(QmjRunResult result);
}
