package com.sitesmith.core.generation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * {@link TextGenerator} backed by a Spring AI chat model.
 *
 * <p>Section patches take two calls: one writes the new section between
 * {@code <!-- name begin -->} and {@code <!-- name end -->} markers, the
 * second splices it into the document.
 */
@Service
public class SpringAiTextGenerator implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(SpringAiTextGenerator.class);

    static final String SITE_SYSTEM_PROMPT = """
            You are an expert website generator creating modern, accessible, responsive \
            single-page websites with Tailwind CSS and Vue.js 3 (global build via CDN).

            Requirements:
            - Output a COMPLETE standalone HTML file with lang="en" on the html element.
            - Use semantic HTML5 elements and mount one Vue app (Options API) on <div id="app">.
            - Style with Tailwind classes; use Font Awesome for icons.
            - Every <img> needs a descriptive alt attribute; keep text contrast at least 4.5:1.
            - Mark major sections with <!-- name begin --> and <!-- name end --> comments.
            - When assets are listed, use their URLs and honour their aspect ratios.

            Output ONLY the HTML. No markdown fences, no explanations.""";

    static final String SECTION_SYSTEM_PROMPT = """
            You are an expert front-end developer rewriting one section of an existing \
            single-page website built with Tailwind CSS and Vue.js 3 (Options API).
            Output MUST begin with <!-- %1$s begin --> and end with <!-- %1$s end -->.
            Output ONLY that section's HTML. No markdown fences, no explanations.""";

    static final String MERGE_SYSTEM_PROMPT = """
            You integrate a rewritten section into an HTML document.
            Replace the content between <!-- %1$s begin --> and <!-- %1$s end --> with the new section. \
            If the markers are missing, put the section where it belongs semantically.
            Do not change any other part of the document.
            Output ONLY the complete HTML document. No markdown fences, no explanations.""";

    private final ChatClient chatClient;

    public SpringAiTextGenerator(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    @Override
    public String generate(String currentDocument, String instructions, String context, List<AssetRef> assets) {
        var user = new StringBuilder();
        if (currentDocument != null) {
            user.append("<CURRENT_HTML>\n").append(currentDocument).append("\n</CURRENT_HTML>\n");
        }
        user.append(userBlock(instructions, context, assets));
        user.append(currentDocument == null
                ? "\nGenerate the complete website."
                : "\nReturn the complete updated website.");
        return call("generate", SITE_SYSTEM_PROMPT, user.toString());
    }

    @Override
    public String patchSection(String currentDocument, String sectionName, String instructions, String context,
                               List<AssetRef> assets) {
        String sectionUser = "<CURRENT_HTML>\n" + currentDocument + "\n</CURRENT_HTML>\n"
                + "<TARGET_SECTION>" + sectionName + "</TARGET_SECTION>\n"
                + userBlock(instructions, context, assets);
        String section = call("section", SECTION_SYSTEM_PROMPT.formatted(sectionName), sectionUser);

        String mergeUser = "<CURRENT_HTML>\n" + currentDocument + "\n</CURRENT_HTML>\n"
                + "<NEW_SECTION_CONTENT section=\"" + sectionName + "\">\n" + section + "\n</NEW_SECTION_CONTENT>";
        return call("merge", MERGE_SYSTEM_PROMPT.formatted(sectionName), mergeUser);
    }

    static String userBlock(String instructions, String context, List<AssetRef> assets) {
        var sb = new StringBuilder();
        sb.append("<USER_INSTRUCTIONS>\n").append(instructions).append("\n</USER_INSTRUCTIONS>\n");
        sb.append("<ADDITIONAL_CONTEXT>")
                .append(context == null || context.isBlank() ? "None" : "\n" + context + "\n")
                .append("</ADDITIONAL_CONTEXT>\n");
        if (assets == null || assets.isEmpty()) {
            sb.append("<ASSETS_TO_USE>None</ASSETS_TO_USE>\n");
        } else {
            String listed = IntStream.range(0, assets.size())
                    .mapToObj(i -> "Asset %d:\nDescription: %s\nURL: %s\nType: %s".formatted(
                            i + 1, assets.get(i).description(), assets.get(i).url(), assets.get(i).contentType()))
                    .collect(Collectors.joining("\n"));
            sb.append("<ASSETS_TO_USE>\n").append(listed).append("\n</ASSETS_TO_USE>\n");
        }
        return sb.toString();
    }

    private String call(String step, String system, String user) {
        long start = System.currentTimeMillis();
        String content = chatClient.prompt()
                .system(system)
                .user(user)
                .call()
                .content();
        log.info("Text generation '{}' complete ({}s)", step,
                String.format("%.1f", (System.currentTimeMillis() - start) / 1000.0));
        if (content == null || content.isBlank()) {
            throw new IllegalStateException("Model returned empty content for step " + step);
        }
        return HtmlFences.strip(content);
    }
}
