package com.tablehub.gameservice.engine.core;

/**
 * 资源种类；ordinal 即资源向量下标。
 */
public enum Resource {
    WOOD,
    BRICK,
    SHEEP,
    WHEAT,
    ORE;

    public static final int COUNT = values().length;
}
