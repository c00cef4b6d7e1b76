package com.chunkforge.engine.decomposition;

import com.chunkforge.engine.model.ChunkDraft;
import com.chunkforge.engine.model.ChunkType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword-based split of a free-text project request into chunks.
 *
 * Architecture, core components, styling and documentation are always
 * produced; the rest depend on words found in the request. Schema-backed
 * chunks depend on {@code schema} when there is one.
 */
@Component
public class PromptDecomposer {

    private static final Logger log = LoggerFactory.getLogger(PromptDecomposer.class);

    public TaskDecomposition decompose(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("prompt is required");
        }
        String words = prompt.toLowerCase(Locale.ROOT);

        boolean hasDatabase  = containsAny(words, "database", "storage", "persist", "sql");
        boolean hasAuth      = containsAny(words, "auth", "login", "user", "account");
        boolean hasApi       = containsAny(words, "api", "endpoint", "rest", "graphql");
        boolean hasDashboard = containsAny(words, "dashboard", "admin", "analytics");
        boolean hasRealtime  = containsAny(words, "chat", "message", "real-time");
        boolean hasTests     = containsAny(words, "test", "testing", "tdd");

        List<ChunkDraft> chunks = new ArrayList<>();
        chunks.add(ChunkDraft.builder(ChunkType.ARCHITECTURE, "Project Architecture")
                .id("architecture")
                .description("Define folder structure, dependencies and core configuration")
                .prompt("Create the project architecture for: " + prompt
                        + "\n\nDefine: folder structure, build dependencies, configuration and core utilities.")
                .targetFiles("package.json", "tsconfig.json", "src/index.ts", "src/types.ts")
                .priority(100)
                .build());

        if (hasDatabase) {
            chunks.add(ChunkDraft.builder(ChunkType.SCHEMA, "Database Schema")
                    .id("schema")
                    .description("Design and implement database tables and relationships")
                    .prompt("Design the database schema for: " + prompt
                            + "\n\nCreate the schema with proper types, relations and indexes.")
                    .targetFiles("src/db/schema.ts", "src/db/index.ts")
                    .priority(90)
                    .build());
        }

        if (hasAuth) {
            chunks.add(withSchema(ChunkDraft.builder(ChunkType.API, "Authentication System")
                    .id("auth")
                    .description("Implement user authentication and session management")
                    .prompt("Implement authentication for: " + prompt
                            + "\n\nCreate login/register endpoints, session handling and middleware.")
                    .targetFiles("src/auth/index.ts", "src/middleware/auth.ts")
                    .priority(85), hasDatabase));
        }

        if (hasApi) {
            chunks.add(withSchema(ChunkDraft.builder(ChunkType.API, "API Endpoints")
                    .id("api")
                    .description("Create REST/GraphQL API endpoints")
                    .prompt("Implement API endpoints for: " + prompt
                            + "\n\nCreate CRUD operations with proper validation and error handling.")
                    .targetFiles("src/routes/index.ts")
                    .priority(80), hasDatabase));
        }

        chunks.add(ChunkDraft.builder(ChunkType.COMPONENT, "Core UI Components")
                .id("components")
                .description("Build reusable UI components")
                .prompt("Create core UI components for: " + prompt
                        + "\n\nBuild responsive, reusable components.")
                .targetFiles("src/components/")
                .priority(70)
                .build());

        if (hasDashboard) {
            chunks.add(ChunkDraft.builder(ChunkType.COMPONENT, "Dashboard Pages")
                    .id("dashboard")
                    .description("Create dashboard views and charts")
                    .prompt("Build dashboard pages for: " + prompt
                            + "\n\nCreate data visualization and admin interfaces.")
                    .targetFiles("src/pages/dashboard/")
                    .dependsOn("components")
                    .priority(65)
                    .build());
        }

        if (hasRealtime) {
            chunks.add(ChunkDraft.builder(ChunkType.INTEGRATION, "Real-time Features")
                    .id("realtime")
                    .description("Implement WebSocket/SSE for real-time updates")
                    .prompt("Add real-time features for: " + prompt
                            + "\n\nImplement WebSocket or SSE for live updates.")
                    .targetFiles("src/socket/index.ts", "src/hooks/useRealtime.ts")
                    .priority(55)
                    .build());
        }

        chunks.add(ChunkDraft.builder(ChunkType.STYLING, "Styling & Theming")
                .id("styling")
                .description("Apply consistent styling and dark mode")
                .prompt("Style the application for: " + prompt
                        + "\n\nApply consistent theming, dark mode and responsive design.")
                .targetFiles("src/styles/")
                .priority(50)
                .build());

        if (hasTests) {
            chunks.add(ChunkDraft.builder(ChunkType.TESTING, "Test Suite")
                    .id("tests")
                    .description("Write unit and integration tests")
                    .prompt("Create tests for: " + prompt
                            + "\n\nWrite tests for components and API endpoints.")
                    .targetFiles("src/__tests__/")
                    .priority(40)
                    .build());
        }

        chunks.add(ChunkDraft.builder(ChunkType.DOCUMENTATION, "Documentation")
                .id("docs")
                .description("Write README and API documentation")
                .prompt("Document the project: " + prompt
                        + "\n\nCreate a README with setup instructions and API docs.")
                .targetFiles("README.md", "docs/")
                .priority(30)
                .build());

        TaskDecomposition decomposition = TaskDecomposition.of(chunks);
        log.debug("Decomposed request into {} chunk(s), ~{} tokens",
                chunks.size(), decomposition.estimatedTotalTokens());
        return decomposition;
    }

    private static ChunkDraft withSchema(ChunkDraft.Builder builder, boolean hasSchema) {
        return (hasSchema ? builder.dependsOn("schema") : builder).build();
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) return true;
        }
        return false;
    }
}
