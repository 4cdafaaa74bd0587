package com.gentoro.codenexus.mcp;

import com.gentoro.codenexus.exception.CodeNexusErrorCode;
import com.gentoro.codenexus.exception.CodeNexusException;
import com.gentoro.codenexus.exception.ConfigException;
import com.gentoro.codenexus.exception.ErrorDetails;
import com.gentoro.codenexus.exception.ExceptionUtil;
import com.gentoro.codenexus.project.ProjectContext;
import com.gentoro.codenexus.project.ProjectRegistry;
import com.gentoro.codenexus.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The CodeNexus tool surface. Every tool takes {@code project_path}; file arguments are validated
 * against the project root and normalized before they reach a manager.
 *
 * <p>Results are JSON text. Mutations answer {@code {"success": true, "message": ...}}, queries
 * answer with their data, and failures answer {@code {"error": {"code", "message",
 * "suggestion"}}} with the error flag set.
 */
public class CodeNexusTools {
  private static final org.slf4j.Logger log =
      com.gentoro.codenexus.logging.LoggingService.getLogger(CodeNexusTools.class);

  private static final String PROJECT_PATH = "project_path";
  private static final String FILE_PATH = "file_path";

  private final ProjectRegistry registry;
  private final Map<String, ToolDefinition> definitions = new LinkedHashMap<>();

  public CodeNexusTools(ProjectRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    registerTagTools();
    registerCommentTools();
    registerRelationTools();
    registerQueryTools();
  }

  public List<ToolDefinition> definitions() {
    return List.copyOf(definitions.values());
  }

  /** Run a tool by name. Never throws; failures are returned as error responses. */
  public ToolResponse call(String name, Map<String, Object> arguments) {
    ToolDefinition definition = definitions.get(name);
    try {
      if (definition == null) {
        throw new ConfigException("Unknown tool: " + name);
      }
      Object result = definition.handler().handle(new ToolArguments(arguments));
      String content = result instanceof String text ? text : JacksonUtility.toCompactJson(result);
      return new ToolResponse(content, false);
    } catch (CodeNexusException e) {
      log.warn("Tool {} failed [{}]: {}", name, e.getCode(), e.getMessage());
      return new ToolResponse(errorResponse(ExceptionUtil.toErrorDetails(e)), true);
    } catch (RuntimeException e) {
      log.error(
          "Tool {} failed unexpectedly at {}",
          name,
          ExceptionUtil.formatCompactStackTrace(e, 3),
          e);
      return new ToolResponse(errorResponse(ExceptionUtil.toErrorDetails(e)), true);
    }
  }

  static String successResponse(String message) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("message", message);
    return JacksonUtility.toCompactJson(body);
  }

  static String errorResponse(ErrorDetails details) {
    CodeNexusErrorCode code =
        details.code == null ? CodeNexusErrorCode.INTERNAL_ERROR : details.code;
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", code.name());
    error.put("message", details.message);
    error.put("suggestion", details.suggestion == null ? code.suggestion() : details.suggestion);
    return JacksonUtility.toCompactJson(Map.of("error", error));
  }

  private void registerTagTools() {
    register(
        ToolDefinition.builder()
            .name("add_file_tags")
            .description("Add tags to a file. Tags use the type:value format, e.g. category:api")
            .parameter(projectPath())
            .parameter(filePath())
            .parameter(
                ToolProperty.builder()
                    .name("tags")
                    .description("Tags to add, each in type:value format")
                    .type(ToolProperty.Type.ARRAY)
                    .items(ToolProperty.Type.STRING)
                    .build())
            .handler(
                onFile(
                    (ctx, file, args) -> {
                      ctx.tags().addTags(file, args.requireStringList("tags"));
                      return successResponse("Tags added successfully");
                    })));

    register(
        ToolDefinition.builder()
            .name("remove_file_tags")
            .description("Remove tags from a file")
            .parameter(projectPath())
            .parameter(filePath())
            .parameter(
                ToolProperty.builder()
                    .name("tags")
                    .description("Tags to remove")
                    .type(ToolProperty.Type.ARRAY)
                    .items(ToolProperty.Type.STRING)
                    .build())
            .handler(
                onFile(
                    (ctx, file, args) -> {
                      ctx.tags().removeTags(file, args.requireStringList("tags"));
                      return successResponse("Tags removed successfully");
                    })));

    register(
        ToolDefinition.builder()
            .name("query_files_by_tags")
            .description(
                "Find files by tag query. Supports AND, OR, NOT, parentheses and * wildcards,"
                    + " e.g. 'category:api AND NOT status:deprecated'")
            .parameter(projectPath())
            .parameter(
                ToolProperty.builder().name("query").description("Tag query expression").build())
            .handler(
                onProject(
                    (ctx, args) ->
                        ctx.queryService().executeTagQuery(args.optionalString("query")))));

    register(
        ToolDefinition.builder()
            .name("get_all_tags")
            .description("List every tag in use, grouped by tag type")
            .parameter(projectPath())
            .handler(onProject((ctx, args) -> ctx.tags().getAllTags())));
  }

  private void registerCommentTools() {
    register(
        ToolDefinition.builder()
            .name("add_file_comment")
            .description("Attach a comment to a file that has none yet")
            .parameter(projectPath())
            .parameter(filePath())
            .parameter(comment())
            .handler(
                onFile(
                    (ctx, file, args) -> {
                      ctx.comments().addComment(file, args.requireString("comment"));
                      return successResponse("Comment added successfully");
                    })));

    register(
        ToolDefinition.builder()
            .name("update_file_comment")
            .description("Set or replace the comment of a file")
            .parameter(projectPath())
            .parameter(filePath())
            .parameter(comment())
            .handler(
                onFile(
                    (ctx, file, args) -> {
                      ctx.comments().updateComment(file, args.requireString("comment"));
                      return successResponse("Comment updated successfully");
                    })));
  }

  private void registerRelationTools() {
    register(
        ToolDefinition.builder()
            .name("add_file_relation")
            .description("Record a described, directed relation from one file to another")
            .parameter(projectPath())
            .parameter(fromFile())
            .parameter(toFile())
            .parameter(
                ToolProperty.builder()
                    .name("description")
                    .description("What the relation means, e.g. 'uses the auth helpers'")
                    .build())
            .handler(
                onProject(
                    (ctx, args) -> {
                      String from = ctx.relativePath(args.requireString("from_file"));
                      String to = ctx.relativePath(args.requireString("to_file"));
                      ctx.relations().addRelation(from, to, args.requireString("description"));
                      return successResponse("Relation added successfully");
                    })));

    register(
        ToolDefinition.builder()
            .name("remove_file_relation")
            .description("Remove the relation from one file to another")
            .parameter(projectPath())
            .parameter(fromFile())
            .parameter(toFile())
            .handler(
                onProject(
                    (ctx, args) -> {
                      String from = ctx.relativePath(args.requireString("from_file"));
                      String to = ctx.relativePath(args.requireString("to_file"));
                      ctx.relations().removeRelation(from, to);
                      return successResponse("Relation removed successfully");
                    })));

    register(
        ToolDefinition.builder()
            .name("query_file_relations")
            .description("List the relations starting at a file")
            .parameter(projectPath())
            .parameter(filePath())
            .handler(onFile((ctx, file, args) -> ctx.relations().getOutgoing(file))));

    register(
        ToolDefinition.builder()
            .name("query_incoming_relations")
            .description("List the relations pointing at a file")
            .parameter(projectPath())
            .parameter(filePath())
            .handler(onFile((ctx, file, args) -> ctx.relations().getIncoming(file))));

    register(
        ToolDefinition.builder()
            .name("get_relation_graph")
            .description("Follow outgoing relations from a file up to a maximum depth")
            .parameter(projectPath())
            .parameter(filePath())
            .parameter(
                ToolProperty.builder()
                    .name("max_depth")
                    .description("Number of hops to follow, defaults to 3")
                    .type(ToolProperty.Type.INTEGER)
                    .required(false)
                    .build())
            .handler(
                onFile(
                    (ctx, file, args) -> {
                      int depth = ctx.graphDepth(args.optionalInt("max_depth"));
                      return ctx.relations().getRelationGraph(file, depth);
                    })));

    register(
        ToolDefinition.builder()
            .name("cleanup_invalid_relations")
            .description("Remove relations whose source or target file no longer exists")
            .parameter(projectPath())
            .handler(
                onProject(
                    (ctx, args) -> {
                      int removed = ctx.relations().cleanupInvalidRelations();
                      Map<String, Object> body = new LinkedHashMap<>();
                      body.put("success", true);
                      body.put("message", "Removed " + removed + " invalid relation(s)");
                      body.put("removed", removed);
                      return body;
                    })));
  }

  private void registerQueryTools() {
    register(
        ToolDefinition.builder()
            .name("get_file_info")
            .description("Tags, comment and relations of a file")
            .parameter(projectPath())
            .parameter(filePath())
            .handler(onFile((ctx, file, args) -> ctx.queryService().getFileInfo(file))));

    register(
        ToolDefinition.builder()
            .name("get_system_status")
            .description("Counts of tagged, commented and related files, plus all tags")
            .parameter(projectPath())
            .handler(onProject((ctx, args) -> ctx.queryService().getSystemStatus())));

    register(
        ToolDefinition.builder()
            .name("search_files")
            .description("Search comments and relation descriptions for a keyword")
            .parameter(projectPath())
            .parameter(
                ToolProperty.builder().name("keyword").description("Text to look for").build())
            .handler(
                onProject(
                    (ctx, args) -> ctx.queryService().searchFiles(args.requireString("keyword")))));
  }

  private void register(ToolDefinition.Builder builder) {
    ToolDefinition definition = builder.build();
    definitions.put(definition.name(), definition);
  }

  private interface ProjectOperation {
    Object apply(ProjectContext context, ToolArguments arguments);
  }

  private interface FileOperation {
    Object apply(ProjectContext context, String file, ToolArguments arguments);
  }

  private ToolHandler onProject(ProjectOperation operation) {
    return args -> operation.apply(registry.getOrCreate(args.requireString(PROJECT_PATH)), args);
  }

  private ToolHandler onFile(FileOperation operation) {
    return onProject(
        (ctx, args) -> operation.apply(ctx, ctx.relativePath(args.requireString(FILE_PATH)), args));
  }

  private static ToolProperty projectPath() {
    return stringParameter(PROJECT_PATH, "Absolute path of the project root directory");
  }

  private static ToolProperty filePath() {
    return stringParameter(FILE_PATH, "File path relative to the project root");
  }

  private static ToolProperty fromFile() {
    return stringParameter("from_file", "Source file, relative to the project root");
  }

  private static ToolProperty toFile() {
    return stringParameter("to_file", "Target file, relative to the project root");
  }

  private static ToolProperty comment() {
    return stringParameter("comment", "Comment text");
  }

  private static ToolProperty stringParameter(String name, String description) {
    return ToolProperty.builder().name(name).description(description).build();
  }
}
