package com.starscape.astrocat.features.images.domain;

public enum ImageSubtype {
    SUB_FRAME,
    INTEGRATION_MASTER,
    INTEGRATION_DEPRECATED,
    PLANETARY
}
