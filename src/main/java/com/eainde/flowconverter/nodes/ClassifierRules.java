package com.eainde.flowconverter.nodes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.eainde.flowconverter.nodes.NodeCategory.AGENT;
import static com.eainde.flowconverter.nodes.NodeCategory.CHAIN;
import static com.eainde.flowconverter.nodes.NodeCategory.CHAT_MODEL;
import static com.eainde.flowconverter.nodes.NodeCategory.CUSTOM;
import static com.eainde.flowconverter.nodes.NodeCategory.DOCUMENT_LOADER;
import static com.eainde.flowconverter.nodes.NodeCategory.DOCUMENT_TRANSFORMER;
import static com.eainde.flowconverter.nodes.NodeCategory.EMBEDDING;
import static com.eainde.flowconverter.nodes.NodeCategory.LLM;
import static com.eainde.flowconverter.nodes.NodeCategory.MEMORY;
import static com.eainde.flowconverter.nodes.NodeCategory.OUTPUT_PARSER;
import static com.eainde.flowconverter.nodes.NodeCategory.PROMPT;
import static com.eainde.flowconverter.nodes.NodeCategory.RETRIEVER;
import static com.eainde.flowconverter.nodes.NodeCategory.ROUTER;
import static com.eainde.flowconverter.nodes.NodeCategory.TEXT_SPLITTER;
import static com.eainde.flowconverter.nodes.NodeCategory.TOOL;
import static com.eainde.flowconverter.nodes.NodeCategory.UTILITY;
import static com.eainde.flowconverter.nodes.NodeCategory.VECTOR_STORE;

/**
 * Heuristic tables used by {@link NodeClassifier}, kept as ordered data.
 *
 * <p>{@link #IDENTIFIER_TABLE} maps known Langflow / LangChain class paths to a
 * category; iteration order is the tie-break order of the substring lookup.
 * {@link #KEYWORD_RULES} is scanned top to bottom against the lower-cased class
 * name and the first rule with a matching keyword wins, so more specific groups
 * (chat models) sit above broader ones (plain LLMs).</p>
 *
 * <p>Adding a category or identifier means adding a row here; the classifier's
 * dispatch does not change.</p>
 */
public final class ClassifierRules {

    private ClassifierRules() {}

    /** Exact class path → category, in tie-break order. */
    public static final Map<String, NodeCategory> IDENTIFIER_TABLE = buildIdentifierTable();

    /** Keyword groups in priority order. */
    public static final List<KeywordRule> KEYWORD_RULES = List.of(
            new KeywordRule(CHAT_MODEL, "chatmodel", "chatgpt", "chatvertexai", "chatanthropic",
                    "chatcohere", "chatollama", "chatpalm"),
            new KeywordRule(LLM, "llm", "openai", "anthropic", "cohere", "huggingface", "vertexai",
                    "palm", "ollama", "bedrock"),
            new KeywordRule(OUTPUT_PARSER, "parser", "outputparser", "jsonoutput", "pydanticoutput",
                    "regexparser", "structuredoutput"),
            new KeywordRule(ROUTER, "router", "multiprompt", "llmrouter"),
            new KeywordRule(DOCUMENT_TRANSFORMER, "documentcompressor", "embeddings_filter",
                    "embeddings_redundant", "llmchainfilter"),
            new KeywordRule(CHAIN, "chain"),
            new KeywordRule(AGENT, "agent", "executor"),
            new KeywordRule(TOOL, "tool"),
            new KeywordRule(MEMORY, "memory", "chatmessagehistory"),
            new KeywordRule(PROMPT, "prompt", "template", "exampleselector", "messageprompt"),
            new KeywordRule(RETRIEVER, "retriever", "contextualcompression", "multiquery", "selfquery",
                    "timeweighted", "webresearch", "ensemble", "parentdocument"),
            new KeywordRule(VECTOR_STORE, "vectorstore", "faiss", "chroma", "pinecone", "qdrant", "redis",
                    "weaviate", "milvus", "elasticsearch", "pgvector", "supabase", "mongodb"),
            new KeywordRule(EMBEDDING, "embedding", "embeddings", "sentencetransformer",
                    "tensorflowhubeembeddings"),
            new KeywordRule(DOCUMENT_LOADER, "document", "loader", "textloader", "pdfloader", "csvloader",
                    "jsonloader", "excelloader", "webbaseloader", "youtubeloader", "directoryloader",
                    "emailloader", "imageloader", "blobloader"),
            new KeywordRule(TEXT_SPLITTER, "splitter", "textsplitter", "charactertextsplitter",
                    "recursivetextsplitter", "tokentextsplitter", "markdowntextsplitter",
                    "htmltextsplitter", "pythoncodetextsplitter", "latextextsplitter"),
            new KeywordRule(UTILITY, "python", "function", "apiwrapper", "serpapi", "wikipedia", "tavily",
                    "googlesearch", "bingsearch", "searx", "arxiv", "openweathermap", "sqldatabase",
                    "wolframalpha", "zapier", "graphql")
    );

    /**
     * A keyword group: the rule matches when the class name contains any keyword.
     */
    public record KeywordRule(NodeCategory category, List<String> keywords) {

        public KeywordRule(NodeCategory category, String... keywords) {
            this(category, List.of(keywords));
        }

        public boolean matches(String lowerCaseClassName) {
            for (String keyword : keywords) {
                if (lowerCaseClassName.contains(keyword)) {
                    return true;
                }
            }
            return false;
        }
    }

    private static void entry(Map<String, NodeCategory> table, String classPath, NodeCategory category) {
        if (table.put(classPath, category) != null) {
            throw new IllegalStateException("Duplicate identifier in classifier table: " + classPath);
        }
    }

    private static Map<String, NodeCategory> buildIdentifierTable() {
        Map<String, NodeCategory> table = new LinkedHashMap<>();
        // LLM Nodes
        entry(table, "langflow.interface.llms.base", LLM);
        entry(table, "langflow.interface.llms.chatmodels", CHAT_MODEL);
        entry(table, "langchain.llms.openai.OpenAI", LLM);
        entry(table, "langchain.llms.openai.AzureOpenAI", LLM);
        entry(table, "langchain.chat_models.openai.ChatOpenAI", CHAT_MODEL);
        entry(table, "langchain.chat_models.openai.AzureChatOpenAI", CHAT_MODEL);
        entry(table, "langchain.llms.huggingface_hub.HuggingFaceHub", LLM);
        entry(table, "langchain.llms.huggingface_pipeline.HuggingFacePipeline", LLM);
        entry(table, "langchain.llms.huggingface_endpoint.HuggingFaceEndpoint", LLM);
        entry(table, "langchain.llms.anthropic.ChatAnthropic", CHAT_MODEL);
        entry(table, "langchain.chat_models.anthropic.ChatAnthropic", CHAT_MODEL);
        entry(table, "langchain.llms.cohere.Cohere", LLM);
        entry(table, "langchain.chat_models.cohere.ChatCohere", CHAT_MODEL);
        entry(table, "langchain.llms.ollama.Ollama", LLM);
        entry(table, "langchain.chat_models.ollama.ChatOllama", CHAT_MODEL);
        entry(table, "langchain.llms.vertexai.VertexAI", LLM);
        entry(table, "langchain.chat_models.vertexai.ChatVertexAI", CHAT_MODEL);
        entry(table, "langchain.llms.google_palm.GooglePalm", LLM);
        entry(table, "langchain.chat_models.google_palm.ChatGooglePalm", CHAT_MODEL);

        // Chain Nodes
        entry(table, "langflow.interface.chains.base", CHAIN);
        entry(table, "langchain.chains.llm.LLMChain", CHAIN);
        entry(table, "langchain.chains.conversation.ConversationChain", CHAIN);
        entry(table, "langchain.chains.qa_with_sources.QAWithSourcesChain", CHAIN);
        entry(table, "langchain.chains.retrieval_qa.base.RetrievalQA", CHAIN);
        entry(table, "langchain.chains.router.base.RouterChain", ROUTER);
        entry(table, "langchain.chains.router.multi_prompt.MultiPromptChain", ROUTER);
        entry(table, "langchain.chains.router.llm_router.LLMRouterChain", ROUTER);
        entry(table, "langchain.chains.sequential.SequentialChain", CHAIN);
        entry(table, "langchain.chains.transform.TransformChain", CHAIN);
        entry(table, "langchain.chains.summarize.SummarizeChain", CHAIN);
        entry(table, "langchain.chains.mapreduce.MapReduceChain", CHAIN);
        entry(table, "langchain.chains.combine_documents.base.BaseCombineDocumentsChain", CHAIN);
        entry(table, "langchain.chains.combine_documents.stuff.StuffDocumentsChain", CHAIN);
        entry(table, "langchain.chains.combine_documents.map_reduce.MapReduceDocumentsChain", CHAIN);
        entry(table, "langchain.chains.combine_documents.refine.RefineDocumentsChain", CHAIN);
        entry(table, "langchain.chains.graph_qa.base.GraphQAChain", CHAIN);
        entry(table, "langchain.chains.openai_functions.base.create_openai_fn_chain", CHAIN);
        entry(table, "langchain.chains.openai_functions.base.create_structured_output_chain", CHAIN);

        // Agent Nodes
        entry(table, "langflow.interface.agents.base", AGENT);
        entry(table, "langchain.agents.agent.AgentExecutor", AGENT);
        entry(table, "langchain.agents.conversational.base.ConversationalAgent", AGENT);
        entry(table, "langchain.agents.mrkl.base.ZeroShotAgent", AGENT);
        entry(table, "langchain.agents.react.base.ReActAgent", AGENT);
        entry(table, "langchain.agents.self_ask_with_search.base.SelfAskWithSearchAgent", AGENT);
        entry(table, "langchain.agents.openai_functions_agent.base.OpenAIFunctionsAgent", AGENT);
        entry(table, "langchain.agents.openai_functions_multi_agent.base.OpenAIMultiFunctionsAgent", AGENT);
        entry(table, "langchain.agents.structured_chat.base.StructuredChatAgent", AGENT);
        entry(table, "langchain.agents.agent_toolkits.sql.base.create_sql_agent", AGENT);
        entry(table, "langchain.agents.agent_toolkits.json.base.create_json_agent", AGENT);
        entry(table, "langchain.agents.agent_toolkits.csv.base.create_csv_agent", AGENT);
        entry(table, "langchain.agents.agent_toolkits.vectorstore.base.create_vectorstore_agent", AGENT);

        // Tool Nodes
        entry(table, "langflow.interface.tools.base", TOOL);
        entry(table, "langchain.tools.base.BaseTool", TOOL);
        entry(table, "langchain.tools.python.tool.PythonREPLTool", TOOL);
        entry(table, "langchain.tools.requests.tool.RequestsTool", TOOL);
        entry(table, "langchain.tools.search.tool.SearchTool", TOOL);
        entry(table, "langchain.tools.shell.tool.ShellTool", TOOL);
        entry(table, "langchain.tools.bing_search.tool.BingSearchTool", TOOL);
        entry(table, "langchain.tools.google_search.tool.GoogleSearchTool", TOOL);
        entry(table, "langchain.tools.searx_search.tool.SearxSearchTool", TOOL);
        entry(table, "langchain.tools.tavily_search.TavilySearchResults", TOOL);
        entry(table, "langchain.tools.arxiv.tool.ArxivQueryRun", TOOL);
        entry(table, "langchain.tools.wikipedia.tool.WikipediaQueryRun", TOOL);
        entry(table, "langchain.tools.sql_database.tool.QuerySQLDataBaseTool", TOOL);
        entry(table, "langchain.tools.openapi.utils.api_models.APIOperation", TOOL);
        entry(table, "langchain.tools.json.tool.JsonSpec", TOOL);
        entry(table, "langchain.tools.file_management.file.ReadFileTool", TOOL);
        entry(table, "langchain.tools.file_management.file.WriteFileTool", TOOL);
        entry(table, "langchain.tools.file_management.file.ListDirectoryTool", TOOL);
        entry(table, "langchain.tools.human.tool.HumanInputRun", TOOL);

        // Output Parser Nodes
        entry(table, "langchain.output_parsers.regex.RegexParser", OUTPUT_PARSER);
        entry(table, "langchain.output_parsers.pydantic.PydanticOutputParser", OUTPUT_PARSER);
        entry(table, "langchain.output_parsers.json.JsonOutputParser", OUTPUT_PARSER);
        entry(table, "langchain.output_parsers.structured.StructuredOutputParser", OUTPUT_PARSER);
        entry(table, "langchain.output_parsers.format_instructions.StructuredOutputParser", OUTPUT_PARSER);
        entry(table, "langchain.output_parsers.openai_functions.JsonOutputFunctionsParser", OUTPUT_PARSER);
        entry(table, "langchain.output_parsers.openai_functions.PydanticOutputFunctionsParser", OUTPUT_PARSER);

        // Memory Nodes
        entry(table, "langflow.interface.memory.base", MEMORY);
        entry(table, "langchain.memory.buffer.ConversationBufferMemory", MEMORY);
        entry(table, "langchain.memory.buffer_window.ConversationBufferWindowMemory", MEMORY);
        entry(table, "langchain.memory.summary.ConversationSummaryMemory", MEMORY);
        entry(table, "langchain.memory.summary_buffer.ConversationSummaryBufferMemory", MEMORY);
        entry(table, "langchain.memory.chat_message_histories.in_memory.ChatMessageHistory", MEMORY);
        entry(table, "langchain.memory.chat_message_histories.redis.RedisChatMessageHistory", MEMORY);
        entry(table, "langchain.memory.chat_message_histories.file.FileChatMessageHistory", MEMORY);
        entry(table, "langchain.memory.chat_message_histories.postgres.PostgresChatMessageHistory", MEMORY);
        entry(table, "langchain.memory.entity.entity_memory.EntityMemory", MEMORY);
        entry(table, "langchain.memory.token_buffer.ConversationTokenBufferMemory", MEMORY);
        entry(table, "langchain.memory.combined.CombinedMemory", MEMORY);
        entry(table, "langchain.memory.vector_store.VectorStoreRetrieverMemory", MEMORY);

        // Prompt Nodes
        entry(table, "langflow.interface.prompts.base", PROMPT);
        entry(table, "langchain.prompts.prompt.PromptTemplate", PROMPT);
        entry(table, "langchain.prompts.chat.ChatPromptTemplate", PROMPT);
        entry(table, "langchain.prompts.chat.HumanMessagePromptTemplate", PROMPT);
        entry(table, "langchain.prompts.chat.AIMessagePromptTemplate", PROMPT);
        entry(table, "langchain.prompts.chat.SystemMessagePromptTemplate", PROMPT);
        entry(table, "langchain.prompts.few_shot.FewShotPromptTemplate", PROMPT);
        entry(table, "langchain.prompts.pipeline.PipelinePromptTemplate", PROMPT);
        entry(table, "langchain.prompts.example_selector.base.BaseExampleSelector", PROMPT);
        entry(table, "langchain.prompts.example_selector.semantic_similarity.SemanticSimilarityExampleSelector", PROMPT);
        entry(table, "langchain.prompts.example_selector.length_based.LengthBasedExampleSelector", PROMPT);
        entry(table, "langchain.prompts.example_selector.ngram_overlap.NGramOverlapExampleSelector", PROMPT);
        entry(table, "langchain.prompts.example_selector.mmr.MaxMarginalRelevanceExampleSelector", PROMPT);

        // Retriever Nodes
        entry(table, "langflow.interface.retrievers.base", RETRIEVER);
        entry(table, "langchain.retrievers.contextual_compression.ContextualCompressionRetriever", RETRIEVER);
        entry(table, "langchain.retrievers.document_compressors.base.DocumentCompressorRetriever", RETRIEVER);
        entry(table, "langchain.retrievers.document_compressors.base.BaseDocumentCompressor", DOCUMENT_TRANSFORMER);
        entry(table, "langchain.retrievers.document_compressors.embeddings_filter.EmbeddingsFilter", DOCUMENT_TRANSFORMER);
        entry(table, "langchain.retrievers.document_compressors.embeddings_redundant.EmbeddingsRedundantFilter", DOCUMENT_TRANSFORMER);
        entry(table, "langchain.retrievers.document_compressors.llm_filter.LLMChainFilter", DOCUMENT_TRANSFORMER);
        entry(table, "langchain.retrievers.multi_query.MultiQueryRetriever", RETRIEVER);
        entry(table, "langchain.retrievers.self_query.base.SelfQueryRetriever", RETRIEVER);
        entry(table, "langchain.retrievers.time_weighted.TimeWeightedVectorStoreRetriever", RETRIEVER);
        entry(table, "langchain.retrievers.web_research.WebResearchRetriever", RETRIEVER);
        entry(table, "langchain.retrievers.ensemble.EnsembleRetriever", RETRIEVER);
        entry(table, "langchain.retrievers.parent_document.ParentDocumentRetriever", RETRIEVER);

        // VectorStore Nodes
        entry(table, "langflow.interface.vectorstores.base", VECTOR_STORE);
        entry(table, "langchain.vectorstores.chroma.Chroma", VECTOR_STORE);
        entry(table, "langchain.vectorstores.faiss.FAISS", VECTOR_STORE);
        entry(table, "langchain.vectorstores.pinecone.Pinecone", VECTOR_STORE);
        entry(table, "langchain.vectorstores.qdrant.Qdrant", VECTOR_STORE);
        entry(table, "langchain.vectorstores.redis.Redis", VECTOR_STORE);
        entry(table, "langchain.vectorstores.weaviate.Weaviate", VECTOR_STORE);
        entry(table, "langchain.vectorstores.milvus.Milvus", VECTOR_STORE);
        entry(table, "langchain.vectorstores.elasticsearch.ElasticsearchStore", VECTOR_STORE);
        entry(table, "langchain.vectorstores.pgvector.PGVector", VECTOR_STORE);
        entry(table, "langchain.vectorstores.supabase.SupabaseVectorStore", VECTOR_STORE);
        entry(table, "langchain.vectorstores.mongodb_atlas.MongoDBAtlasVectorSearch", VECTOR_STORE);

        // Embedding Nodes
        entry(table, "langflow.interface.embeddings.base", EMBEDDING);
        entry(table, "langchain.embeddings.openai.OpenAIEmbeddings", EMBEDDING);
        entry(table, "langchain.embeddings.huggingface.HuggingFaceEmbeddings", EMBEDDING);
        entry(table, "langchain.embeddings.cohere.CohereEmbeddings", EMBEDDING);
        entry(table, "langchain.embeddings.vertexai.VertexAIEmbeddings", EMBEDDING);
        entry(table, "langchain.embeddings.google_palm.GooglePalmEmbeddings", EMBEDDING);
        entry(table, "langchain.embeddings.ollama.OllamaEmbeddings", EMBEDDING);
        entry(table, "langchain.embeddings.bedrock.BedrockEmbeddings", EMBEDDING);
        entry(table, "langchain.embeddings.sentence_transformer.SentenceTransformerEmbeddings", EMBEDDING);
        entry(table, "langchain.embeddings.tensorflow_hub.TensorflowHubEmbeddings", EMBEDDING);
        entry(table, "langchain.embeddings.fake.FakeEmbeddings", EMBEDDING);

        // Document Nodes
        entry(table, "langflow.interface.document_loaders.base", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.text.TextLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.pdf.PyPDFLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.csv_loader.CSVLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.json_loader.JSONLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.excel.UnstructuredExcelLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.web_base.WebBaseLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.youtube.YoutubeLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.directory.DirectoryLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.email.UnstructuredEmailLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.image.UnstructuredImageLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.image_captions.ImageCaptionLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.parsers.pdf.PyPDFParser", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.blob_loaders.file_system.FileSystemBlobLoader", DOCUMENT_LOADER);
        entry(table, "langchain.document_loaders.blob_loaders.youtube.YoutubeAudioLoader", DOCUMENT_LOADER);

        // Text Splitter Nodes
        entry(table, "langflow.interface.text_splitters.base", TEXT_SPLITTER);
        entry(table, "langchain.text_splitter.CharacterTextSplitter", TEXT_SPLITTER);
        entry(table, "langchain.text_splitter.RecursiveCharacterTextSplitter", TEXT_SPLITTER);
        entry(table, "langchain.text_splitter.TokenTextSplitter", TEXT_SPLITTER);
        entry(table, "langchain.text_splitter.SentenceTransformersTokenTextSplitter", TEXT_SPLITTER);
        entry(table, "langchain.text_splitter.MarkdownTextSplitter", TEXT_SPLITTER);
        entry(table, "langchain.text_splitter.HTMLTextSplitter", TEXT_SPLITTER);
        entry(table, "langchain.text_splitter.PythonCodeTextSplitter", TEXT_SPLITTER);
        entry(table, "langchain.text_splitter.LatexTextSplitter", TEXT_SPLITTER);

        // Utility Nodes
        entry(table, "langflow.interface.utilities.base", UTILITY);
        entry(table, "langchain.utilities.python.PythonREPL", UTILITY);
        entry(table, "langchain.utilities.serpapi.SerpAPIWrapper", UTILITY);
        entry(table, "langchain.utilities.wikipedia.WikipediaAPIWrapper", UTILITY);
        entry(table, "langchain.utilities.tavily_search.TavilySearchAPIWrapper", UTILITY);
        entry(table, "langchain.utilities.google_search.GoogleSearchAPIWrapper", UTILITY);
        entry(table, "langchain.utilities.bing_search.BingSearchAPIWrapper", UTILITY);
        entry(table, "langchain.utilities.searx_search.SearxSearchWrapper", UTILITY);
        entry(table, "langchain.utilities.arxiv.ArxivAPIWrapper", UTILITY);
        entry(table, "langchain.utilities.openweathermap.OpenWeatherMapAPIWrapper", UTILITY);
        entry(table, "langchain.utilities.sql_database.SQLDatabase", UTILITY);
        entry(table, "langchain.utilities.wolfram_alpha.WolframAlphaAPIWrapper", UTILITY);
        entry(table, "langchain.utilities.zapier.ZapierNLAWrapper", UTILITY);
        entry(table, "langchain.utilities.graphql.GraphQLAPIWrapper", UTILITY);

        // Custom Nodes
        entry(table, "langflow.custom.base", CUSTOM);
        entry(table, "langflow.custom.utilities.PythonFunction", UTILITY);
        entry(table, "langflow.custom.nodes.CustomNode", CUSTOM);
        entry(table, "langflow.custom.nodes.InputNode", CUSTOM);
        entry(table, "langflow.custom.nodes.OutputNode", CUSTOM);

        return Collections.unmodifiableMap(table);
    }
}
