package com.argoframe.api.hook;

/**
 * 宿主预定义的钩子点
 * 管道也接受任意字符串标识，这里只是约定俗成的名字
 */
public enum HookPoint {
    // 文档处理
    PRE_DOCUMENT_UPLOAD("pre_document_upload"),
    POST_DOCUMENT_UPLOAD("post_document_upload"),
    PRE_DOCUMENT_INDEX("pre_document_index"),
    POST_DOCUMENT_INDEX("post_document_index"),

    // RAG
    PRE_RAG_SEARCH("pre_rag_search"),
    POST_RAG_SEARCH("post_rag_search"),
    PRE_RAG_RERANK("pre_rag_rerank"),
    POST_RAG_RERANK("post_rag_rerank"),

    // LLM
    PRE_LLM_CALL("pre_llm_call"),
    POST_LLM_CALL("post_llm_call"),
    PRE_PROMPT_BUILD("pre_prompt_build"),
    POST_PROMPT_BUILD("post_prompt_build"),

    // 分析
    PRE_ANALYSIS("pre_analysis"),
    POST_ANALYSIS("post_analysis"),

    // 查询处理
    PRE_QUERY_PROCESSING("pre_query_processing"),
    POST_QUERY_PROCESSING("post_query_processing"),

    // 分块
    PRE_CHUNKING("pre_chunking"),
    POST_CHUNKING("post_chunking"),

    // 抽取
    PRE_EXTRACTION("pre_extraction"),
    POST_EXTRACTION("post_extraction");

    private final String key;

    HookPoint(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
