package info.isaksson.erland.niemtograph.graph;

public enum NodeFlag {
    HUB,
    ASSOCIATION,
    AUGMENTATION_HOST
}
