package org.pragmatica.sentinel.frontend;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.Name;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.Type;
import io.vavr.control.Either;
import org.pragmatica.sentinel.shared.SentinelError;
import org.pragmatica.sentinel.shared.SourceFile;
import org.pragmatica.sentinel.tree.Node;
import org.pragmatica.sentinel.tree.NodeKind;
import org.pragmatica.sentinel.tree.Nodes;
import org.pragmatica.sentinel.tree.SourcePosition;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java front end: parses source text with JavaParser and maps every executable body onto an
 * operation tree.
 *
 * Mapping:
 * - block statements become BLOCK;
 * - try statements become TRY_REGION, with try-with-resources declarations placed at the start
 *   of the protected block;
 * - catch clauses become CATCH_CLAUSE and finally blocks FINALLY_REGION, holding the statements
 *   of the respective block directly;
 * - throw statements become THROW_SITE;
 * - lambdas become LAMBDA;
 * - every other statement or expression becomes OTHER.
 *
 * Bodies of nested and anonymous classes are separate blocks; they are not part of the tree of
 * the enclosing method. A field initializer becomes a block of its own when it holds statements,
 * i.e. a lambda or switch expression body.
 */
public class JavaOperationTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(JavaOperationTreeBuilder.class);

    private static final int MAX_LABEL_LENGTH = 80;

    private final JavaParser parser;

    private JavaOperationTreeBuilder() {
        this.parser = createParser();
    }

    /**
     * Factory method.
     */
    public static JavaOperationTreeBuilder javaOperationTreeBuilder() {
        return new JavaOperationTreeBuilder();
    }

    /**
     * Parse the source and return one operation block per executable body, in source order.
     */
    public Either<SentinelError, List<OperationBlock>> build(SourceFile source) {
        return parse(source).map(this::blocks)
                            .peek(blocks -> log.debug("{}: {} operation block(s)", source.fileName(), blocks.size()));
    }

    private Either<SentinelError, CompilationUnit> parse(SourceFile source) {
        var result = parser.parse(source.content());

        if (result.isSuccessful() && result.getResult().isPresent()) {
            return Either.right(result.getResult().get());
        }

        return Either.left(result.getProblems()
                                 .stream()
                                 .findFirst()
                                 .map(problem -> {
                                     var begin = problem.getLocation()
                                                        .flatMap(location -> location.getBegin().getRange())
                                                        .map(range -> range.begin);
                                     return FrontEndError.parseError(source.fileName(),
                                                                     begin.map(position -> position.line).orElse(1),
                                                                     begin.map(position -> position.column).orElse(1),
                                                                     problem.getMessage());
                                 })
                                 .orElseGet(() -> FrontEndError.parseError(source.fileName(), 1, 1, "Unknown parse error")));
    }

    private List<OperationBlock> blocks(CompilationUnit cu) {
        var blocks = new ArrayList<OperationBlock>();

        cu.walk(BodyDeclaration.class, declaration -> blockOf(declaration).forEach(blocks::add));

        return List.copyOf(blocks);
    }

    private List<OperationBlock> blockOf(BodyDeclaration<?> declaration) {
        if (declaration instanceof MethodDeclaration method) {
            return method.getBody()
                         .map(body -> List.of(block(method, method.getNameAsString() + "(..)", body)))
                         .orElse(List.of());
        }
        if (declaration instanceof ConstructorDeclaration constructor) {
            return List.of(block(constructor, "<init>(..)", constructor.getBody()));
        }
        if (declaration instanceof CompactConstructorDeclaration compact) {
            return List.of(block(compact, "<init>", compact.getBody()));
        }
        if (declaration instanceof InitializerDeclaration initializer) {
            return List.of(block(initializer, initializer.isStatic() ? "<clinit>" : "<init-block>", initializer.getBody()));
        }
        if (declaration instanceof FieldDeclaration field) {
            return field.getVariables()
                        .stream()
                        .filter(variable -> variable.getInitializer()
                                                    .filter(JavaOperationTreeBuilder::hasExecutableCode)
                                                    .isPresent())
                        .map(variable -> OperationBlock.operationBlock(owner(field) + variable.getNameAsString(),
                                                                       position(variable),
                                                                       Nodes.block(position(variable),
                                                                                   List.of(convert(variable.getInitializer().get())))))
                        .toList();
        }
        return List.of();
    }

    // Plain expressions cannot throw from a finally region; statements come from lambda and switch expression bodies
    private static boolean hasExecutableCode(Expression initializer) {
        return !initializer.findAll(Statement.class).isEmpty();
    }

    private OperationBlock block(BodyDeclaration<?> declaration, String name, BlockStmt body) {
        return OperationBlock.operationBlock(owner(declaration) + name, position(declaration), convert(body));
    }

    private static String owner(BodyDeclaration<?> declaration) {
        return declaration.findAncestor(TypeDeclaration.class)
                          .map(type -> type.getNameAsString() + ".")
                          .orElse("");
    }

    private Node convert(com.github.javaparser.ast.Node source) {
        if (source instanceof BlockStmt block) {
            return Nodes.block(position(block), convertAll(block.getStatements()));
        }
        if (source instanceof TryStmt tryStmt) {
            return convertTry(tryStmt);
        }
        if (source instanceof ThrowStmt throwStmt) {
            return Node.node(NodeKind.THROW_SITE,
                             label("throw " + throwStmt.getExpression()),
                             position(throwStmt),
                             List.of(convert(throwStmt.getExpression())));
        }
        if (source instanceof LambdaExpr lambda) {
            return Node.node(NodeKind.LAMBDA, label(lambda.toString()), position(lambda), List.of(convert(lambda.getBody())));
        }
        return Node.node(NodeKind.OTHER, source.getClass().getSimpleName(), position(source), convertAll(operands(source)));
    }

    private Node convertTry(TryStmt tryStmt) {
        var protectedStatements = new ArrayList<Node>(convertAll(tryStmt.getResources()));
        protectedStatements.addAll(convertAll(tryStmt.getTryBlock().getStatements()));

        var body = Nodes.block(position(tryStmt.getTryBlock()), protectedStatements);
        var catches = tryStmt.getCatchClauses()
                             .stream()
                             .map(this::convertCatch)
                             .toList();
        var finallyRegion = tryStmt.getFinallyBlock()
                                   .map(block -> Nodes.finallyRegion(position(block), convertAll(block.getStatements())))
                                   .orElse(null);

        return Nodes.tryRegion(position(tryStmt), body, catches, finallyRegion);
    }

    private Node convertCatch(CatchClause clause) {
        return Nodes.catchClause(label("catch (" + clause.getParameter() + ")"),
                                 position(clause),
                                 convertAll(clause.getBody().getStatements()));
    }

    private List<Node> convertAll(List<? extends com.github.javaparser.ast.Node> sources) {
        return sources.stream()
                      .map(this::convert)
                      .toList();
    }

    // Children that can hold executable code; names, types, comments and nested declarations are dropped
    private static List<com.github.javaparser.ast.Node> operands(com.github.javaparser.ast.Node source) {
        return source.getChildNodes()
                     .stream()
                     .filter(child -> !(child instanceof SimpleName
                                        || child instanceof Name
                                        || child instanceof Type
                                        || child instanceof Comment
                                        || child instanceof Modifier
                                        || child instanceof Parameter
                                        || child instanceof BodyDeclaration))
                     .toList();
    }

    private static SourcePosition position(com.github.javaparser.ast.Node node) {
        return node.getBegin()
                   .map(begin -> SourcePosition.sourcePosition(begin.line, begin.column))
                   .orElse(SourcePosition.UNKNOWN);
    }

    private static String label(String text) {
        var singleLine = text.replaceAll("\\s+", " ").trim();
        return singleLine.length() <= MAX_LABEL_LENGTH
               ? singleLine
               : singleLine.substring(0, MAX_LABEL_LENGTH - 3) + "...";
    }

    private JavaParser createParser() {
        var configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_21);
        return new JavaParser(configuration);
    }
}
