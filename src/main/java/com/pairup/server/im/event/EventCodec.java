package com.pairup.server.im.event;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import com.pairup.server.im.exception.MalformedFrameException;
import com.pairup.server.im.exception.UnknownEventException;
import org.springframework.stereotype.Component;

/**
 * Text frame &lt;-&gt; {@link ChatEvent}. The {@code type} field is read first and selects the variant.
 */
@Component
public class EventCodec {

    public ChatEvent decode(String text) {
        if (text == null || text.isBlank()) {
            throw new MalformedFrameException("empty frame");
        }

        JSONObject json;
        try {
            json = JSON.parseObject(text);
        } catch (JSONException | ClassCastException e) {
            throw new MalformedFrameException("frame is not a JSON object", e);
        }
        if (json == null) {
            throw new MalformedFrameException("frame is not a JSON object");
        }

        String wireName = json.getString("type");
        EventType type = EventType.fromWireName(wireName);
        if (type == null) {
            throw new UnknownEventException(wireName);
        }

        try {
            return json.toJavaObject(type.getFrameClass());
        } catch (JSONException | NumberFormatException e) {
            throw new MalformedFrameException("invalid " + wireName + " frame", e);
        }
    }

    public String encode(ChatEvent event) {
        return JSON.toJSONString(event);
    }
}
