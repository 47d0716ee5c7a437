package info.isaksson.erland.niemtograph.core;

import info.isaksson.erland.niemtograph.convert.ConversionConfig;
import info.isaksson.erland.niemtograph.convert.ConversionMode;
import info.isaksson.erland.niemtograph.document.DocumentFormat;
import info.isaksson.erland.niemtograph.mapping.MappingTable;

/**
 * Core (server-friendly) options for NIEM to graph conversion.
 *
 * <p>This mirrors the CLI flags in a structured form. The conversion settings are turned into a
 * {@link ConversionConfig} by {@link #toConfig()}; the rest control input handling and batches.</p>
 */
public final class NiemToGraphOptions {
    /** Input format; null detects it from the content. */
    public DocumentFormat format = null;

    /** Expected root element ({@code prefix:local}); null accepts any root. */
    public String rootName = null;

    public ConversionMode mode = ConversionMode.DYNAMIC;
    public MappingTable mappingTable = MappingTable.empty();
    public boolean strictReferences = true;
    public boolean strictMapping = false;
    public String hubLabel = ConversionConfig.DEFAULT_HUB_LABEL;
    public boolean forwardReferences = true;
    public boolean tolerateNilReferences = false;
    public String augmentationSuffix = ConversionConfig.DEFAULT_AUGMENTATION_SUFFIX;

    /**
     * Batch only: merge hubs and resolve references across the documents of one batch, producing a
     * single graph.
     */
    public boolean sharedNamespace = false;

    /** Batch only: number of worker threads for the per-document passes. */
    public int threads = Math.max(1, Runtime.getRuntime().availableProcessors());

    /** Options carrying the settings of an already loaded configuration. */
    public static NiemToGraphOptions from(ConversionConfig config) {
        NiemToGraphOptions o = new NiemToGraphOptions();
        if (config == null) return o;
        o.mode = config.mode;
        o.mappingTable = config.mappingTable;
        o.strictReferences = config.strictReferences;
        o.strictMapping = config.strictMapping;
        o.hubLabel = config.hubLabel;
        o.forwardReferences = config.forwardReferences;
        o.tolerateNilReferences = config.tolerateNilReferences;
        o.augmentationSuffix = config.augmentationSuffix;
        return o;
    }

    /**
     * @throws IllegalArgumentException when the settings are inconsistent, e.g. strict mapping in dynamic mode
     */
    public ConversionConfig toConfig() {
        return ConversionConfig.builder()
                .mode(mode)
                .mappingTable(mappingTable)
                .strictReferences(strictReferences)
                .strictMapping(strictMapping)
                .hubLabel(hubLabel)
                .forwardReferences(forwardReferences)
                .tolerateNilReferences(tolerateNilReferences)
                .augmentationSuffix(augmentationSuffix)
                .build();
    }
}
