package com.phillippitts.voicenotes.service.extraction;

/**
 * Builds the extraction instruction. Every generated field must be written in the
 * transcript's own language; the detected language code is passed as a hint only.
 */
public final class ExtractionPromptBuilder {

    private ExtractionPromptBuilder() {}

    public static String build(String transcript, String language) {
        boolean hasLanguage = language != null && !language.isBlank();
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Analyze the following voice transcript and extract structured information.\n\n");
        sb.append("Transcript: \"").append(transcript).append("\"\n");
        if (hasLanguage) {
            sb.append("Detected Language Code: \"").append(language).append("\"\n");
        }
        sb.append('\n');
        sb.append("Instructions:\n");
        sb.append("1. Identify the language of the transcript");
        if (hasLanguage) {
            sb.append(" (likely '").append(language).append("' based on initial detection)");
        }
        sb.append(" and write ALL generated output in that language: title, summary, key facts, todos, ")
          .append("research answers and draft content. Do NOT translate to English unless the transcript ")
          .append("is in English.\n\n");
        sb.append("2. Determine the PRIMARY intent:\n")
          .append("   - TODO: action items or tasks to be done\n")
          .append("   - RESEARCH: a question or request for information or analysis\n")
          .append("   - DRAFT: a request to write something (email, message, document)\n")
          .append("   - NOTE: general information, observations or thoughts to remember\n\n");
        sb.append("3. Extract, in the transcript's language:\n")
          .append("   - a clear, concise title\n")
          .append("   - 2-5 relevant tags\n")
          .append("   - a 2-3 sentence summary\n")
          .append("   - key facts (names, dates, amounts, specific details)\n\n");
        sb.append("4. Populate the data field for the intent and set every other data field to null:\n")
          .append("   - TODO: todos with a clear task each, done=false, due=null when no date is mentioned. ")
          .append("researchAnswer and draftContent are null.\n")
          .append("   - RESEARCH: researchAnswer with a thorough answer. todos and draftContent are null.\n")
          .append("   - DRAFT: draftContent with polished, ready-to-use text. todos and researchAnswer are null.\n")
          .append("   - NOTE: todos, researchAnswer and draftContent are all null.\n\n");
        sb.append("IMPORTANT: Output strictly in the same language as the transcript. Do not translate.");
        return sb.toString();
    }
}
