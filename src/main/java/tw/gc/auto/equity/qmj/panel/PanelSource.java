package tw.gc.auto.equity.qmj.panel;

/**
 * Supplies the input panel from the ingestion side.
 */
public interface PanelSource {

    /**
     * Loads the complete panel.
     *
     * @throws tw.gc.auto.equity.qmj.config.QmjConfigurationException if required columns are missing
     * @throws IllegalArgumentException if a value is malformed
     */
    PanelStore loadPanel();
}
