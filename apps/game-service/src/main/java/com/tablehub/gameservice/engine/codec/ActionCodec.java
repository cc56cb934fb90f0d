package com.tablehub.gameservice.engine.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.tablehub.gameservice.common.error.ValidationException;
import com.tablehub.gameservice.engine.core.ActionType;
import com.tablehub.gameservice.engine.core.GameAction;
import com.tablehub.gameservice.engine.core.Resource;
import com.tablehub.gameservice.engine.core.SeatColor;
import com.tablehub.gameservice.engine.core.SimpleAction;
import com.tablehub.gameservice.engine.core.TradeOffer;
import com.tablehub.gameservice.engine.core.TradeResponse;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 动作编解码：线上格式为 {@code [color, type, value?]}。
 * <p>
 * type 是判别字段，每个变体一个解码器；OFFER_TRADE 的 value 为 10 个非负整数
 * （前 5 个为给出，后 5 个为索取），其余变体不带参数（接受 / 拒绝附带的 value 忽略）。
 * 任何格式问题都抛 {@link ValidationException}。
 */
@Component
public class ActionCodec {

    @FunctionalInterface
    interface VariantDecoder {
        GameAction decode(SeatColor color, JsonNode value);
    }

    private final Map<ActionType, VariantDecoder> decoders = new EnumMap<>(ActionType.class);

    public ActionCodec() {
        decoders.put(ActionType.ROLL, (c, v) -> simple(c, ActionType.ROLL, v));
        decoders.put(ActionType.BUILD, (c, v) -> simple(c, ActionType.BUILD, v));
        decoders.put(ActionType.END_TURN, (c, v) -> simple(c, ActionType.END_TURN, v));
        decoders.put(ActionType.CANCEL_TRADE, (c, v) -> simple(c, ActionType.CANCEL_TRADE, v));
        decoders.put(ActionType.OFFER_TRADE, this::offer);
        decoders.put(ActionType.ACCEPT_TRADE, (c, v) -> new TradeResponse(c, true));
        decoders.put(ActionType.REJECT_TRADE, (c, v) -> new TradeResponse(c, false));
    }

    public GameAction decode(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new ValidationException("action 不能为空");
        }
        if (!payload.isArray() || payload.size() < 2 || payload.size() > 3) {
            throw new ValidationException("action 格式应为 [color, type, value]");
        }
        SeatColor color = parseEnum(SeatColor.class, payload.get(0), "color");
        ActionType type = parseEnum(ActionType.class, payload.get(1), "type");
        JsonNode value = payload.size() == 3 ? payload.get(2) : NullNode.getInstance();
        return decoders.get(type).decode(color, value);
    }

    /** 编码为线上格式（供投影中的合法动作列表使用） */
    public List<Object> encode(GameAction action) {
        List<Object> out = new ArrayList<>(3);
        out.add(action.color().name());
        out.add(action.type().name());
        if (action instanceof TradeOffer o) {
            List<Integer> v = new ArrayList<>(Resource.COUNT * 2);
            Arrays.stream(o.offer()).forEach(v::add);
            Arrays.stream(o.request()).forEach(v::add);
            out.add(v);
        } else {
            out.add(null);
        }
        return out;
    }

    private GameAction simple(SeatColor color, ActionType type, JsonNode value) {
        if (value != null && !value.isNull()) {
            throw new ValidationException(type + " 不接受参数");
        }
        return new SimpleAction(color, type);
    }

    private GameAction offer(SeatColor color, JsonNode value) {
        if (value == null || !value.isArray() || value.size() != Resource.COUNT * 2) {
            throw new ValidationException("OFFER_TRADE 需要 10 个整数（给出 5 + 索取 5）");
        }
        int[] offer = new int[Resource.COUNT];
        int[] request = new int[Resource.COUNT];
        for (int i = 0; i < Resource.COUNT * 2; i++) {
            JsonNode n = value.get(i);
            if (n == null || !n.isIntegralNumber() || !n.canConvertToInt() || n.asInt() < 0) {
                throw new ValidationException("OFFER_TRADE 第 " + i + " 项必须是非负整数");
            }
            if (i < Resource.COUNT) {
                offer[i] = n.asInt();
            } else {
                request[i - Resource.COUNT] = n.asInt();
            }
        }
        return new TradeOffer(color, offer, request);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, JsonNode node, String field) {
        if (node == null || !node.isTextual()) {
            throw new ValidationException(field + " 必须是字符串");
        }
        try {
            return Enum.valueOf(type, node.asText().trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("未知的 " + field + ": " + node.asText(), e);
        }
    }
}
