package com.tablehub.gameservice.games.pvp.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 多人房间配置（tablehub.pvp.*）
 */
@Data
@ConfigurationProperties(prefix = "tablehub.pvp")
public class PvpRoomProperties {

    /** 开局所需的最少入座人数 */
    private int minPlayersToStart = 2;

    /** 房间列表最多返回条数 */
    private int listLimit = 100;
}
