package com.tablehub.gameservice.infrastructure.jpa;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.tablehub.gameservice.common.error.InternalException;
import com.tablehub.gameservice.engine.core.MatchState;
import org.springframework.stereotype.Component;

/**
 * MatchState <-> stateBlob（fastjson2）
 */
@Component
public class StateCodec {

    public String encode(MatchState state) {
        return JSON.toJSONString(state);
    }

    public MatchState decode(String blob) {
        try {
            MatchState state = JSON.parseObject(blob, MatchState.class);
            if (state == null) {
                throw new InternalException("快照内容为空", null);
            }
            return state;
        } catch (JSONException e) {
            throw new InternalException("快照反序列化失败", e);
        }
    }
}
