package com.flamingo.ai.ragpipeline.service.rag.answer;

import java.util.Arrays;
import java.util.stream.Collectors;

/** Prompt text for grounded answers and cleanup of the model's reply. */
public final class AnswerPrompts {

  public static final String NOT_FOUND_ANSWER = "No answer found in provided documents.";

  private AnswerPrompts() {}

  /**
   * Builds the answer prompt.
   *
   * @param context the grounding context, one {@code [Source i: file]} block per chunk
   * @param question the user's question
   * @return the prompt
   */
  public static String answerPrompt(String context, String question) {
    return """
        Answer the question using ONLY the information from the provided documents. \
        If the answer is not found in the documents, respond with "%s"

        Format your response as:
        Answer: [your answer here]
        Citation: [document name(s)]

        Documents:
        %s

        Question: %s

        Examples:
        Question: What is Docker used for?
        Answer: Docker is used for containerization, allowing applications to run in isolated \
        environments.
        Citation: Docker.pdf

        Question: What programming language is best for web development?
        Answer: %s
        Citation: None

        Answer:"""
        .formatted(NOT_FOUND_ANSWER, context, question, NOT_FOUND_ANSWER);
  }

  /**
   * Drops blank lines and lines echoing the prompt's {@code Question:} or {@code Context:} labels.
   * Returns the stripped original when nothing else is left.
   */
  public static String clean(String raw) {
    String cleaned =
        Arrays.stream(raw.split("\n"))
            .map(String::strip)
            .filter(line -> !line.isEmpty())
            .filter(line -> !line.startsWith("Question:") && !line.startsWith("Context:"))
            .collect(Collectors.joining("\n"))
            .strip();
    return cleaned.isEmpty() ? raw.strip() : cleaned;
  }
}
