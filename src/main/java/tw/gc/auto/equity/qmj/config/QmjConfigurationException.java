package tw.gc.auto.equity.qmj.config;

/**
 * Fatal setup problem (bad configuration or an input panel with missing
 * columns). Raised before any period is processed.
 */
public class QmjConfigurationException extends RuntimeException {

    public QmjConfigurationException(String message) {
        super(message);
    }
}
