package com.tablehub.gameservice.games.standalone.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 单机对局配置（tablehub.games.*）
 */
@Data
@ConfigurationProperties(prefix = "tablehub.games")
public class GamesProperties {

    /** 对局列表最多返回条数 */
    private int listLimit = 200;
}
