package com.meddollina.assistant.service.orchestration;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import com.meddollina.assistant.model.ChatTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TokenCounter {

    private static final Logger log = LoggerFactory.getLogger(TokenCounter.class);
    private static final int PER_MESSAGE_OVERHEAD = 4;

    private final Encoding encoding;

    public TokenCounter() {
        this.encoding = loadEncoding();
    }

    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        if (encoding == null) {
            return text.length() / 4;
        }
        try {
            return encoding.countTokens(text);
        } catch (RuntimeException ex) {
            log.debug("Token counting failed, using length estimate: {}", ex.getMessage());
            return text.length() / 4;
        }
    }

    public int count(List<ChatTurn> messages) {
        int total = 0;
        for (ChatTurn message : messages) {
            total += PER_MESSAGE_OVERHEAD + count(message.role().wireName()) + count(message.content());
        }
        return total;
    }

    private static Encoding loadEncoding() {
        try {
            return Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
        } catch (RuntimeException ex) {
            log.warn("Could not load cl100k_base encoding, token counts will be estimated: {}", ex.getMessage());
            return null;
        }
    }
}
