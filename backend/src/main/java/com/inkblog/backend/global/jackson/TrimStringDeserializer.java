package com.inkblog.backend.global.jackson;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;

/**
 * 앞뒤 공백을 잘라서 받는 문자열 필드용 역직렬화기 (@JsonDeserialize(using = ...))
 *
 * - 공백만 있는 값은 null 로 바꾼다. 그래서 @NotBlank 검증 메시지가 한 가지로 모인다.
 * - 비밀번호 필드에는 붙이지 않는다. (공백도 입력값)
 */
public class TrimStringDeserializer extends StdScalarDeserializer<String> {

    public TrimStringDeserializer() {
        super(String.class);
    }

    @Override
    public String deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String raw = p.getValueAsString();
        if (raw == null) {
            return null;
        }
        String trimmed = raw.strip();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
