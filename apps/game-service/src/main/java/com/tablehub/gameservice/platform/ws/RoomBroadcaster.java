package com.tablehub.gameservice.platform.ws;

import com.tablehub.gameservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 房间广播：/topic/pvp.room.{roomId}
 * 广播在请求成功之后进行，失败只记日志，不影响已提交的结果。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomBroadcaster {

    public static final String TOPIC_PREFIX = "/topic/pvp.room.";

    private final SimpMessagingTemplate messagingTemplate;

    public void room(String roomId, Object roomView) {
        send(roomId, Envelope.room(roomId, roomView));
    }

    public void state(String roomId, Object snapshotView, long version) {
        send(roomId, Envelope.state(roomId, snapshotView, version));
    }

    private void send(String roomId, Envelope<?> envelope) {
        try {
            messagingTemplate.convertAndSend(TOPIC_PREFIX + roomId, envelope);
        } catch (MessagingException e) {
            log.warn("房间广播失败: roomId={}, kind={}", roomId, envelope.getKind(), e);
        }
    }
}
