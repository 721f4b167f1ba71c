package com.adlanda.ethicsassistant.service;

import org.springframework.ai.chat.prompt.PromptTemplate;

import java.util.Map;

/**
 * Prompt templates for the assistant.
 */
public final class Prompts {

    /**
     * Role and behaviour of the assistant for answer generation.
     */
    public static final String SYSTEM_PROMPT = """
            You are an AI Ethics Assistant, a knowledgeable expert on AI policy, ethics, governance, and regulation.
            Your role is to provide accurate, helpful, and well-informed responses about AI ethics topics based on the provided context from authoritative documents.

            Inputs:
            - User reformulated query: Enhanced version of the user's question optimized for document retrieval
            - Context from AI Ethics Documents: Relevant excerpts from retrieved documents with source filenames

            Guidelines:
            - Provide clear, accurate, and comprehensive answers based on the context
            - Your answer should directly address the user's question
            - If the context doesn't contain enough information, acknowledge this limitation
            - Focus on practical guidance and actionable insights when appropriate
            - Use specific examples from the context when relevant
            - Maintain a professional but approachable tone
            - Do not make up information that isn't supported by the context
            - Keep your answer concise and focused on the user's question
            - Use bullet points or numbered lists for clarity when appropriate
            """;

    static final String REFORMULATION_TEMPLATE = """
            You are an AI assistant helping users find information about AI policy and ethics.

            The user has asked: "{query}"

            Reformulate this query to be more comprehensive and likely to match relevant content in AI ethics documents.
            Add related terms, expand acronyms, and make the query more specific to AI policy, ethics, governance, or regulation topics.

            Return only the reformulated query, nothing else.""";

    static final String RAG_TEMPLATE = """
            Context from AI Ethics Documents:
            {context}

            User Question: {query}

            Provide a comprehensive answer based on the context above.
            If the context doesn't fully address the question,
            mention what information is available and what might be missing.
            """;

    private Prompts() {
    }

    public static String reformulation(String userQuery) {
        return new PromptTemplate(REFORMULATION_TEMPLATE).render(Map.of("query", userQuery));
    }

    /**
     * User content for answer generation: retrieved context plus the original question.
     */
    public static String rag(String context, String userQuery) {
        return new PromptTemplate(RAG_TEMPLATE).render(Map.of("context", context, "query", userQuery));
    }
}
