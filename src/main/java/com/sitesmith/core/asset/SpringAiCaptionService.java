package com.sitesmith.core.asset;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.stereotype.Service;
import org.springframework.util.MimeTypeUtils;

/**
 * Captions images with a vision-capable chat model via Spring AI.
 */
@Service
public class SpringAiCaptionService implements CaptionService {

    private static final Logger log = LoggerFactory.getLogger(SpringAiCaptionService.class);

    static final String PROMPT = """
            For the following image, provide a detailed English description for use as metadata. \
            Your response must include:
            - A concise, descriptive caption of the image.
            - An assessment of the image quality (sharpness, clarity, noise, compression artifacts).
            - A description of the color palette, including dominant colors and notable contrasts.

            Format your response as follows:
            Caption: [your caption]
            Quality: [your quality assessment]
            Color Palette: [your color palette description]
            Color Palette in hex: [the palette as hex codes]

            Respond in English only. Do not include any other information or commentary.""";

    private final ChatClient chatClient;

    public SpringAiCaptionService(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    @Override
    public String caption(byte[] image, String contentType) {
        long start = System.currentTimeMillis();
        String text = chatClient.prompt()
                .user(u -> u.text(PROMPT)
                        .media(MimeTypeUtils.parseMimeType(contentType), new ByteArrayResource(image)))
                .call()
                .content();
        log.info("Caption generated ({} bytes, {}ms)", image.length, System.currentTimeMillis() - start);
        return text == null ? "" : text.trim();
    }
}
