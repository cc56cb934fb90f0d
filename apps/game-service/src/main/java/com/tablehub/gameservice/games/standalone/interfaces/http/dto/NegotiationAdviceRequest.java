package com.tablehub.gameservice.games.standalone.interfaces.http.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

/**
 * {"requesterColor": "BLUE", "boardImage": "data:image/png;base64,..."}，两项均可省略
 */
@Data
public class NegotiationAdviceRequest {

    @JsonAlias("requester_color")
    private String requesterColor;

    @JsonAlias("board_image")
    private String boardImage;
}
