package com.querysmith.jena;

import com.querysmith.model.Filter;
import com.querysmith.model.Variable;
import com.querysmith.model.filter.BinaryExpression;
import com.querysmith.model.filter.BinaryOperator;
import com.querysmith.model.filter.ExistsExpression;
import com.querysmith.model.filter.FilterExpression;
import com.querysmith.model.filter.FunctionCall;
import com.querysmith.model.filter.InExpression;
import com.querysmith.model.filter.LiteralExpression;
import com.querysmith.model.filter.UnaryExpression;
import com.querysmith.model.filter.UnaryOperator;
import com.querysmith.model.filter.ValueType;
import com.querysmith.model.filter.VariableExpression;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.graph.Node;
import org.apache.jena.query.QueryException;
import org.apache.jena.shared.PrefixMapping;
import org.apache.jena.sparql.expr.E_Add;
import org.apache.jena.sparql.expr.E_Divide;
import org.apache.jena.sparql.expr.E_Equals;
import org.apache.jena.sparql.expr.E_Exists;
import org.apache.jena.sparql.expr.E_Function;
import org.apache.jena.sparql.expr.E_GreaterThan;
import org.apache.jena.sparql.expr.E_GreaterThanOrEqual;
import org.apache.jena.sparql.expr.E_LessThan;
import org.apache.jena.sparql.expr.E_LessThanOrEqual;
import org.apache.jena.sparql.expr.E_LogicalAnd;
import org.apache.jena.sparql.expr.E_LogicalNot;
import org.apache.jena.sparql.expr.E_LogicalOr;
import org.apache.jena.sparql.expr.E_Multiply;
import org.apache.jena.sparql.expr.E_NotEquals;
import org.apache.jena.sparql.expr.E_NotExists;
import org.apache.jena.sparql.expr.E_NotOneOf;
import org.apache.jena.sparql.expr.E_OneOf;
import org.apache.jena.sparql.expr.E_Subtract;
import org.apache.jena.sparql.expr.E_UnaryMinus;
import org.apache.jena.sparql.expr.E_UnaryPlus;
import org.apache.jena.sparql.expr.Expr;
import org.apache.jena.sparql.expr.ExprFunction;
import org.apache.jena.sparql.expr.ExprFunction1;
import org.apache.jena.sparql.expr.ExprFunction2;
import org.apache.jena.sparql.expr.ExprVar;
import org.apache.jena.sparql.expr.NodeValue;
import org.apache.jena.sparql.serializer.SerializationContext;
import org.apache.jena.sparql.util.ExprUtils;
import org.apache.jena.vocabulary.RDF;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses SPARQL FILTER expression text into a {@link FilterExpression} tree
 * using Jena's expression parser.
 *
 * <p>Supported: variables, literals and IRIs, {@code && || ! = != < <= > >=
 * + - * /}, unary minus and plus, {@code IN} / {@code NOT IN},
 * {@code EXISTS} / {@code NOT EXISTS} and function calls. Built-in function
 * names are upper-cased; extension functions keep their IRI in angle
 * brackets.</p>
 */
public final class FilterExpressionParser {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(FilterExpressionParser.class);

    /** Jena infix operators and their model counterparts. */
    private static final Map<Class<? extends ExprFunction2>, BinaryOperator> BINARY_OPERATORS = Map.ofEntries(
        Map.entry(E_LogicalAnd.class, BinaryOperator.AND),
        Map.entry(E_LogicalOr.class, BinaryOperator.OR),
        Map.entry(E_Equals.class, BinaryOperator.EQUALS),
        Map.entry(E_NotEquals.class, BinaryOperator.NOT_EQUALS),
        Map.entry(E_LessThan.class, BinaryOperator.LESS_THAN),
        Map.entry(E_LessThanOrEqual.class, BinaryOperator.LESS_THAN_OR_EQUAL),
        Map.entry(E_GreaterThan.class, BinaryOperator.GREATER_THAN),
        Map.entry(E_GreaterThanOrEqual.class, BinaryOperator.GREATER_THAN_OR_EQUAL),
        Map.entry(E_Add.class, BinaryOperator.PLUS),
        Map.entry(E_Subtract.class, BinaryOperator.MINUS),
        Map.entry(E_Multiply.class, BinaryOperator.MULTIPLY),
        Map.entry(E_Divide.class, BinaryOperator.DIVIDE));

    private FilterExpressionParser() {
        throw new AssertionError("No instances");
    }

    /**
     * Parse expression text. The standard prefixes ({@code rdf}, {@code rdfs},
     * {@code xsd}, {@code owl}, {@code dc}) are predeclared.
     *
     * @param text the expression, without {@code FILTER( )}
     * @return the expression tree
     * @throws QueryParseException if the text is not a supported expression
     */
    public static FilterExpression parse(final String text) {
        return parse(text, Map.of());
    }

    /**
     * Parse expression text with extra prefix declarations.
     *
     * @param text the expression, without {@code FILTER( )}
     * @param prefixes prefix to namespace IRI
     * @return the expression tree
     * @throws QueryParseException if the text is not a supported expression
     */
    public static FilterExpression parse(final String text, final Map<String, String> prefixes) {
        if (text == null || text.isBlank()) {
            throw new QueryParseException("Filter expression cannot be empty");
        }
        PrefixMapping mapping = PrefixMapping.Factory.create()
            .setNsPrefixes(PrefixMapping.Standard)
            .setNsPrefixes(prefixes);
        Expr expr;
        try {
            expr = ExprUtils.parse(text, mapping);
        } catch (QueryException e) {
            throw new QueryParseException("Invalid filter expression: " + e.getMessage(), e);
        }
        FilterExpression result = convert(expr);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Parsed filter '{}' as {}", text, result.toSparql());
        }
        return result;
    }

    /**
     * Parse the expression of a filter, as produced by
     * {@link SparqlQueryParser}.
     *
     * @param filter the filter
     * @return the expression tree
     * @throws QueryParseException if the text is not a supported expression
     */
    public static FilterExpression parse(final Filter filter) {
        return parse(filter.expression());
    }

    private static FilterExpression convert(final Expr expr) {
        if (expr instanceof ExprVar variable) {
            return new VariableExpression(new Variable(variable.getVarName()));
        }
        if (expr instanceof NodeValue value) {
            return convertConstant(value);
        }
        if (expr instanceof E_Exists exists) {
            return new ExistsExpression(groupContent(exists.getGraphPattern().toString()), false);
        }
        if (expr instanceof E_NotExists notExists) {
            return new ExistsExpression(groupContent(notExists.getGraphPattern().toString()), true);
        }
        if (expr instanceof E_OneOf oneOf) {
            return new InExpression(convert(oneOf.getLHS()), convertAll(oneOf.getRHS()), false);
        }
        if (expr instanceof E_NotOneOf notOneOf) {
            return new InExpression(convert(notOneOf.getLHS()), convertAll(notOneOf.getRHS()), true);
        }
        if (expr instanceof ExprFunction2 binary && BINARY_OPERATORS.containsKey(binary.getClass())) {
            return new BinaryExpression(convert(binary.getArg1()),
                BINARY_OPERATORS.get(binary.getClass()), convert(binary.getArg2()));
        }
        if (expr instanceof E_LogicalNot not) {
            return new UnaryExpression(UnaryOperator.NOT, convert(not.getArg()));
        }
        if (expr instanceof E_UnaryMinus minus) {
            return new UnaryExpression(UnaryOperator.NEGATIVE, convert(minus.getArg()));
        }
        if (expr instanceof E_UnaryPlus plus) {
            return new UnaryExpression(UnaryOperator.POSITIVE, convert(plus.getArg()));
        }
        if (expr instanceof E_Function call) {
            return new FunctionCall("<" + call.getFunctionIRI() + ">", convertAll(call.getArgs()));
        }
        if (expr instanceof ExprFunction function) {
            String name = function.getFunctionPrintName(new SerializationContext());
            return new FunctionCall(name.toUpperCase(Locale.ROOT), convertAll(function.getArgs()));
        }
        throw new QueryParseException("Unsupported filter expression: " + ExprUtils.fmtSPARQL(expr));
    }

    private static List<FilterExpression> convertAll(final Iterable<Expr> exprs) {
        List<FilterExpression> result = new ArrayList<>();
        for (Expr expr : exprs) {
            result.add(convert(expr));
        }
        return result;
    }

    private static LiteralExpression convertConstant(final NodeValue value) {
        Node node = value.asNode();
        if (node.isURI()) {
            return new LiteralExpression(node.getURI(), ValueType.IRI, null, null);
        }
        if (!node.isLiteral()) {
            throw new QueryParseException("Unsupported constant in filter: " + node);
        }
        String lexical = node.getLiteralLexicalForm();
        if (value.isBoolean()) {
            return new LiteralExpression(lexical, ValueType.BOOLEAN, null, null);
        }
        if (value.isNumber()) {
            return new LiteralExpression(lexical, ValueType.NUMBER, null, null);
        }
        String language = node.getLiteralLanguage();
        if (language != null && !language.isEmpty()) {
            return new LiteralExpression(lexical, ValueType.STRING, null, language);
        }
        String datatype = node.getLiteralDatatypeURI();
        if (LiteralExpression.XSD_DATE_TIME.equals(datatype)) {
            return new LiteralExpression(lexical, ValueType.DATE_TIME, null, null);
        }
        if (datatype == null || XSDDatatype.XSDstring.getURI().equals(datatype)
            || RDF.langString.getURI().equals(datatype)) {
            return new LiteralExpression(lexical, ValueType.STRING, null, null);
        }
        return new LiteralExpression(lexical, ValueType.STRING, datatype, null);
    }

    /**
     * Strip the braces Jena prints around an EXISTS group.
     */
    private static String groupContent(final String group) {
        String text = group.trim();
        if (text.startsWith("{") && text.endsWith("}")) {
            text = text.substring(1, text.length() - 1);
        }
        return text.trim().replaceAll("\\s+", " ");
    }
}
