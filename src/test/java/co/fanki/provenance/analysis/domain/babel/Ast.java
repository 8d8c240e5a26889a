package co.fanki.provenance.analysis.domain.babel;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Builds Babel AST nodes for tests, in the shape {@code @babel/parser}
 * emits them. A line of 0 builds a node without location.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Ast {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private Ast() {
    }

    public static ObjectNode node(final String type, final int line) {
        final ObjectNode node = FACTORY.objectNode();
        node.put("type", type);
        if (line > 0) {
            final ObjectNode loc = node.putObject("loc");
            loc.putObject("start").put("line", line).put("column", 0);
            loc.putObject("end").put("line", line).put("column", 1);
        }
        return node;
    }

    public static JsNode js(final ObjectNode node) {
        return JsNode.of(node);
    }

    /** Loads a JSON fixture from the test classpath. */
    public static String fixture(final String path) throws IOException {
        try (InputStream in = Ast.class.getClassLoader()
                .getResourceAsStream(path)) {
            if (in == null) {
                throw new IOException("Missing fixture " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // -- Module structure ----------------------------------------------------

    public static ObjectNode program(final ObjectNode... body) {
        final ObjectNode program = node("Program", 1);
        program.put("sourceType", "module");
        putNodes(program, "body", body);
        return program;
    }

    public static ObjectNode file(final ObjectNode program) {
        final ObjectNode file = node("File", 1);
        file.set("program", program);
        return file;
    }

    public static ObjectNode stmt(final ObjectNode expression) {
        final ObjectNode statement = node("ExpressionStatement",
                JsNode.of(expression).line());
        statement.set("expression", expression);
        return statement;
    }

    public static ObjectNode declare(final String kind, final String name,
            final ObjectNode init, final int line) {
        final ObjectNode declarator = node("VariableDeclarator", line);
        declarator.set("id", id(name, line));
        declarator.set("init", init);
        return declaration(kind, line, declarator);
    }

    public static ObjectNode declaration(final String kind, final int line,
            final ObjectNode... declarators) {
        final ObjectNode declaration = node("VariableDeclaration", line);
        declaration.put("kind", kind);
        putNodes(declaration, "declarations", declarators);
        return declaration;
    }

    public static ObjectNode declarator(final ObjectNode id,
            final ObjectNode init, final int line) {
        final ObjectNode declarator = node("VariableDeclarator", line);
        declarator.set("id", id);
        declarator.set("init", init);
        return declarator;
    }

    public static ObjectNode function(final String name, final int line,
            final ObjectNode... body) {
        final ObjectNode function = node("FunctionDeclaration", line);
        function.set("id", name == null ? null : id(name, line));
        function.putArray("params");
        final ObjectNode block = node("BlockStatement", line);
        putNodes(block, "body", body);
        function.set("body", block);
        return function;
    }

    public static ObjectNode classDecl(final String name, final int line) {
        final ObjectNode declaration = node("ClassDeclaration", line);
        declaration.set("id", id(name, line));
        declaration.set("body", classBody(line));
        return declaration;
    }

    private static ObjectNode classBody(final int line) {
        final ObjectNode body = node("ClassBody", line);
        body.putArray("body");
        return body;
    }

    public static ObjectNode returns(final ObjectNode argument,
            final int line) {
        final ObjectNode statement = node("ReturnStatement", line);
        statement.set("argument", argument);
        return statement;
    }

    // -- Imports and exports -------------------------------------------------

    public static ObjectNode importDecl(final String source, final int line,
            final ObjectNode... specifiers) {
        final ObjectNode declaration = node("ImportDeclaration", line);
        putNodes(declaration, "specifiers", specifiers);
        declaration.set("source", str(source, line));
        return declaration;
    }

    public static ObjectNode importDefault(final String local,
            final int line) {
        final ObjectNode specifier = node("ImportDefaultSpecifier", line);
        specifier.set("local", id(local, line));
        return specifier;
    }

    public static ObjectNode importNamespace(final String local,
            final int line) {
        final ObjectNode specifier = node("ImportNamespaceSpecifier", line);
        specifier.set("local", id(local, line));
        return specifier;
    }

    public static ObjectNode importNamed(final String imported,
            final String local, final int line) {
        final ObjectNode specifier = node("ImportSpecifier", line);
        specifier.set("imported", id(imported, line));
        specifier.set("local", id(local, line));
        return specifier;
    }

    public static ObjectNode exportNamed(final ObjectNode declaration,
            final int line) {
        final ObjectNode export = node("ExportNamedDeclaration", line);
        export.set("declaration", declaration);
        export.putArray("specifiers");
        export.putNull("source");
        return export;
    }

    public static ObjectNode exportSpecifiers(final String source,
            final int line, final ObjectNode... specifiers) {
        final ObjectNode export = node("ExportNamedDeclaration", line);
        export.putNull("declaration");
        putNodes(export, "specifiers", specifiers);
        export.set("source", source == null ? null : str(source, line));
        return export;
    }

    public static ObjectNode exportSpecifier(final String local,
            final String exported, final int line) {
        final ObjectNode specifier = node("ExportSpecifier", line);
        specifier.set("local", id(local, line));
        specifier.set("exported", id(exported, line));
        return specifier;
    }

    public static ObjectNode exportNamespaceSpecifier(final String exported,
            final int line) {
        final ObjectNode specifier = node("ExportNamespaceSpecifier", line);
        specifier.set("exported", id(exported, line));
        return specifier;
    }

    public static ObjectNode exportDefault(final ObjectNode declaration,
            final int line) {
        final ObjectNode export = node("ExportDefaultDeclaration", line);
        export.set("declaration", declaration);
        return export;
    }

    public static ObjectNode exportAll(final String source,
            final String exported, final int line) {
        final ObjectNode export = node("ExportAllDeclaration", line);
        export.set("exported", exported == null ? null : id(exported, line));
        export.set("source", str(source, line));
        return export;
    }

    // -- Expressions ---------------------------------------------------------

    public static ObjectNode id(final String name, final int line) {
        return node("Identifier", line).put("name", name);
    }

    public static ObjectNode str(final String value, final int line) {
        return node("StringLiteral", line).put("value", value);
    }

    public static ObjectNode num(final long value, final int line) {
        return node("NumericLiteral", line).put("value", value);
    }

    public static ObjectNode bool(final boolean value, final int line) {
        return node("BooleanLiteral", line).put("value", value);
    }

    public static ObjectNode nullLiteral(final int line) {
        return node("NullLiteral", line);
    }

    public static ObjectNode member(final ObjectNode object,
            final String property, final int line) {
        final ObjectNode member = node("MemberExpression", line);
        member.set("object", object);
        member.set("property", id(property, line));
        member.put("computed", false);
        return member;
    }

    public static ObjectNode index(final ObjectNode object,
            final ObjectNode property, final int line) {
        final ObjectNode member = node("MemberExpression", line);
        member.set("object", object);
        member.set("property", property);
        member.put("computed", true);
        return member;
    }

    public static ObjectNode call(final ObjectNode callee, final int line,
            final ObjectNode... arguments) {
        final ObjectNode call = node("CallExpression", line);
        call.set("callee", callee);
        putNodes(call, "arguments", arguments);
        return call;
    }

    public static ObjectNode newExpr(final ObjectNode callee, final int line,
            final ObjectNode... arguments) {
        final ObjectNode expr = node("NewExpression", line);
        expr.set("callee", callee);
        putNodes(expr, "arguments", arguments);
        return expr;
    }

    public static ObjectNode spread(final ObjectNode argument,
            final int line) {
        final ObjectNode spread = node("SpreadElement", line);
        spread.set("argument", argument);
        return spread;
    }

    public static ObjectNode binary(final String operator,
            final ObjectNode left, final ObjectNode right, final int line) {
        final ObjectNode expr = node("BinaryExpression", line);
        expr.put("operator", operator);
        expr.set("left", left);
        expr.set("right", right);
        return expr;
    }

    public static ObjectNode logical(final String operator,
            final ObjectNode left, final ObjectNode right, final int line) {
        final ObjectNode expr = binary(operator, left, right, line);
        expr.put("type", "LogicalExpression");
        return expr;
    }

    public static ObjectNode unary(final String operator,
            final ObjectNode argument, final int line) {
        final ObjectNode expr = node("UnaryExpression", line);
        expr.put("operator", operator);
        expr.put("prefix", true);
        expr.set("argument", argument);
        return expr;
    }

    public static ObjectNode update(final ObjectNode argument,
            final int line) {
        final ObjectNode expr = node("UpdateExpression", line);
        expr.put("operator", "++");
        expr.put("prefix", false);
        expr.set("argument", argument);
        return expr;
    }

    public static ObjectNode conditional(final ObjectNode test,
            final ObjectNode consequent, final ObjectNode alternate,
            final int line) {
        final ObjectNode expr = node("ConditionalExpression", line);
        expr.set("test", test);
        expr.set("consequent", consequent);
        expr.set("alternate", alternate);
        return expr;
    }

    public static ObjectNode assign(final ObjectNode left,
            final ObjectNode right, final int line) {
        final ObjectNode expr = node("AssignmentExpression", line);
        expr.put("operator", "=");
        expr.set("left", left);
        expr.set("right", right);
        return expr;
    }

    public static ObjectNode arrow(final ObjectNode body, final int line) {
        final ObjectNode expr = node("ArrowFunctionExpression", line);
        expr.putArray("params");
        expr.set("body", body);
        return expr;
    }

    public static ObjectNode object(final int line,
            final ObjectNode... properties) {
        final ObjectNode object = node("ObjectExpression", line);
        putNodes(object, "properties", properties);
        return object;
    }

    public static ObjectNode prop(final String key, final ObjectNode value,
            final int line) {
        return prop(id(key, line), value, line);
    }

    public static ObjectNode prop(final ObjectNode key,
            final ObjectNode value, final int line) {
        final ObjectNode property = node("ObjectProperty", line);
        property.set("key", key);
        property.set("value", value);
        property.put("computed", false);
        property.put("shorthand", false);
        return property;
    }

    public static ObjectNode computedProp(final ObjectNode key,
            final ObjectNode value, final int line) {
        return prop(key, value, line).put("computed", true);
    }

    /** Builds an array literal; a null element is a hole. */
    public static ObjectNode array(final int line,
            final ObjectNode... elements) {
        final ObjectNode array = node("ArrayExpression", line);
        putNodes(array, "elements", elements);
        return array;
    }

    public static ObjectNode template(final int line,
            final ObjectNode... expressions) {
        final ObjectNode template = node("TemplateLiteral", line);
        final ArrayNode quasis = template.putArray("quasis");
        for (int i = 0; i <= expressions.length; i++) {
            quasis.add(quasi("", i == expressions.length, line));
        }
        putNodes(template, "expressions", expressions);
        return template;
    }

    public static ObjectNode staticTemplate(final String text,
            final int line) {
        final ObjectNode template = node("TemplateLiteral", line);
        template.putArray("quasis").add(quasi(text, true, line));
        template.putArray("expressions");
        return template;
    }

    private static ObjectNode quasi(final String text, final boolean tail,
            final int line) {
        final ObjectNode quasi = node("TemplateElement", line);
        quasi.putObject("value").put("raw", text).put("cooked", text);
        quasi.put("tail", tail);
        return quasi;
    }

    public static ObjectNode processEnv(final String key, final int line) {
        return member(member(id("process", line), "env", line), key, line);
    }

    public static ObjectNode importMetaEnv(final String key, final int line) {
        final ObjectNode meta = node("MetaProperty", line);
        meta.set("meta", id("import", line));
        meta.set("property", id("meta", line));
        return member(member(meta, "env", line), key, line);
    }

    // -- JSX -----------------------------------------------------------------

    public static ObjectNode jsx(final String name, final int line,
            final ObjectNode... children) {
        return jsx(jsxName(name), List.of(), line, children);
    }

    public static ObjectNode jsx(final ObjectNode name,
            final List<ObjectNode> attributes, final int line,
            final ObjectNode... children) {
        final ObjectNode element = node("JSXElement", line);
        final ObjectNode opening = node("JSXOpeningElement", line);
        opening.set("name", name);
        final ArrayNode attributeArray = opening.putArray("attributes");
        attributes.forEach(attributeArray::add);
        opening.put("selfClosing", children.length == 0);
        element.set("openingElement", opening);
        if (children.length == 0) {
            element.putNull("closingElement");
        } else {
            final ObjectNode closing = node("JSXClosingElement", line);
            closing.set("name", name.deepCopy());
            element.set("closingElement", closing);
        }
        putNodes(element, "children", children);
        return element;
    }

    public static ObjectNode jsxName(final String name) {
        return node("JSXIdentifier", 0).put("name", name);
    }

    public static ObjectNode jsxMember(final ObjectNode object,
            final String property) {
        final ObjectNode member = node("JSXMemberExpression", 0);
        member.set("object", object);
        member.set("property", jsxName(property));
        return member;
    }

    public static ObjectNode jsxNamespaced(final String namespace,
            final String name) {
        final ObjectNode namespaced = node("JSXNamespacedName", 0);
        namespaced.set("namespace", jsxName(namespace));
        namespaced.set("name", jsxName(name));
        return namespaced;
    }

    public static ObjectNode jsxAttr(final String name,
            final ObjectNode value, final int line) {
        final ObjectNode attribute = node("JSXAttribute", line);
        attribute.set("name", jsxName(name));
        attribute.set("value", value);
        return attribute;
    }

    public static ObjectNode container(final ObjectNode expression,
            final int line) {
        final ObjectNode container = node("JSXExpressionContainer", line);
        container.set("expression", expression);
        return container;
    }

    public static ObjectNode emptyContainer(final int line) {
        return container(node("JSXEmptyExpression", line), line);
    }

    public static ObjectNode jsxText(final String text, final int line) {
        return node("JSXText", line).put("value", text);
    }

    private static void putNodes(final ObjectNode parent, final String field,
            final ObjectNode... nodes) {
        final ArrayNode array = parent.putArray(field);
        for (final ObjectNode node : nodes) {
            if (node == null) {
                array.addNull();
            } else {
                array.add(node);
            }
        }
    }
}
