package de.bsommerfeld.sysml.sql.schema;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns the raw definitions of a SysML v2 JSON schema into
 * {@link SchemaDefinition}s with fully merged field sets.
 *
 * <h3>Supported shapes</h3>
 * A definition is an object schema ({@code type: object} with
 * {@code properties}), an alias ({@code $ref}), an {@code allOf} list of
 * supertype references and inline object schemas, a top-level
 * {@code anyOf}/{@code oneOf} union whose inline object members contribute
 * fields, or a scalar value definition such as an enumeration. Everything
 * else fails with {@link SchemaException.Kind#UNSUPPORTED_COMBINATOR}.
 *
 * <h3>Resolution</h3>
 * Definitions are resolved in name order on an explicit work stack. A
 * definition is resolved once all of its supertypes are; a supertype that is
 * still on the stack is a genuine inheritance cycle. Properties that merely
 * reference another type never need that type's fields, so mutually
 * referencing types resolve fine.
 *
 * <h3>Merging</h3>
 * {@code allOf} members are merged in declaration order, followed by the
 * definition's own {@code properties}. The first definition of a field name
 * wins.
 */
public class SchemaResolver {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaResolver.class);

    public ResolvedSchema resolve(JsonNode document) throws SchemaException {
        Resolution resolution = new Resolution(definitionsOf(document));
        for (String name : new TreeSet<>(resolution.raw.keySet())) {
            resolution.resolve(name);
        }
        LOG.info("Resolved {} schema definitions", resolution.resolved.size());
        return new ResolvedSchema(resolution.resolved);
    }

    /**
     * Returns the definitions of the document: the {@code $defs} (or
     * {@code definitions}) member if present, otherwise the document itself
     * as a name-to-definition map.
     */
    static Map<String, JsonNode> definitionsOf(JsonNode document) throws SchemaException {
        if (document == null || !document.isObject()) {
            throw SchemaException.malformedSchema("schema document must be a JSON object");
        }
        JsonNode defs = document;
        if (document.has("$defs")) {
            defs = document.get("$defs");
        } else if (document.has("definitions")) {
            defs = document.get("definitions");
        }
        if (!defs.isObject()) {
            throw SchemaException.malformedSchema("definitions must be a JSON object");
        }

        Map<String, JsonNode> raw = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = defs.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (entry.getKey().startsWith("$")) {
                continue;
            }
            if (!entry.getValue().isObject()) {
                throw SchemaException.malformedSchema("definition '" + entry.getKey() + "' is not an object");
            }
            raw.put(entry.getKey(), entry.getValue());
        }
        if (raw.isEmpty()) {
            throw SchemaException.malformedSchema("schema contains no definitions");
        }
        return raw;
    }

    /** {@code https://www.omg.org/spec/SysML/20230201/Element} and {@code #/$defs/Element} both name {@code Element}. */
    static String referenceName(String reference) {
        int slash = reference.lastIndexOf('/');
        return slash >= 0 ? reference.substring(slash + 1) : reference;
    }

    // =====================================================================
    // Definition shapes
    // =====================================================================

    private enum ShapeKind {
        OBJECT,
        ALIAS,
        ALL_OF,
        UNION,
        VALUE
    }

    /** Either a supertype name or an inline object schema. */
    private record Member(String supertype, JsonNode inline) {
    }

    private record Shape(ShapeKind kind, List<Member> members, FieldKind valueKind) {

        List<String> supertypes() {
            List<String> names = new ArrayList<>();
            for (Member member : members) {
                if (member.supertype() != null) {
                    names.add(member.supertype());
                }
            }
            return names;
        }
    }

    /** Classification of a property schema before it gets its name. */
    private record ValueShape(FieldKind kind, String target, boolean nullable, boolean many) {
    }

    private final class Resolution {

        private final Map<String, JsonNode> raw;
        private final Map<String, Shape> shapes = new HashMap<>();
        private final SortedMap<String, SchemaDefinition> resolved = new TreeMap<>();

        Resolution(Map<String, JsonNode> raw) {
            this.raw = raw;
        }

        void resolve(String root) throws SchemaException {
            if (resolved.containsKey(root)) {
                return;
            }
            Deque<String> stack = new ArrayDeque<>();
            Set<String> inProgress = new HashSet<>();
            stack.push(root);
            inProgress.add(root);

            while (!stack.isEmpty()) {
                String current = stack.peek();
                String pending = firstUnresolvedSupertype(current);
                if (pending != null) {
                    if (inProgress.contains(pending)) {
                        throw SchemaException.cyclicInheritance(cyclePath(stack, pending));
                    }
                    stack.push(pending);
                    inProgress.add(pending);
                    continue;
                }
                resolved.put(current, build(current, shape(current)));
                stack.pop();
                inProgress.remove(current);
            }
        }

        private String firstUnresolvedSupertype(String name) throws SchemaException {
            for (String supertype : shape(name).supertypes()) {
                if (!resolved.containsKey(supertype)) {
                    return supertype;
                }
            }
            return null;
        }

        private List<String> cyclePath(Deque<String> stack, String repeated) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            Iterator<String> bottomUp = stack.descendingIterator();
            while (bottomUp.hasNext()) {
                String name = bottomUp.next();
                inCycle |= name.equals(repeated);
                if (inCycle) {
                    cycle.add(name);
                }
            }
            cycle.add(repeated);
            return cycle;
        }

        private Shape shape(String name) throws SchemaException {
            Shape shape = shapes.get(name);
            if (shape == null) {
                shape = parseShape(name, raw.get(name));
                shapes.put(name, shape);
            }
            return shape;
        }

        private Shape parseShape(String name, JsonNode node) throws SchemaException {
            if (node.has("not") || node.has("if")) {
                throw SchemaException.unsupportedCombinator(name, null, "'not' and 'if' are not supported");
            }
            if (node.has("$ref")) {
                return new Shape(ShapeKind.ALIAS, List.of(new Member(refTarget(name, node.get("$ref")), null)), null);
            }
            if (node.has("allOf")) {
                List<Member> members = new ArrayList<>();
                for (JsonNode member : arrayOf(name, node.get("allOf"), "allOf")) {
                    if (member.has("$ref")) {
                        members.add(new Member(refTarget(name, member.get("$ref")), null));
                    } else if (isObjectSchema(member)) {
                        members.add(new Member(null, member));
                    } else {
                        throw SchemaException.unsupportedCombinator(name, null,
                                "allOf member must be a reference or an object schema");
                    }
                }
                if (node.has("properties")) {
                    members.add(new Member(null, node));
                }
                return new Shape(ShapeKind.ALL_OF, members, null);
            }
            String union = node.has("anyOf") ? "anyOf" : node.has("oneOf") ? "oneOf" : null;
            if (union != null) {
                List<Member> members = new ArrayList<>();
                for (JsonNode member : arrayOf(name, node.get(union), union)) {
                    if (member.has("$ref")) {
                        // a variant, not a supertype
                        refTarget(name, member.get("$ref"));
                    } else if (isNullSchema(member)) {
                        continue;
                    } else if (isObjectSchema(member)) {
                        members.add(new Member(null, member));
                    } else {
                        throw SchemaException.unsupportedCombinator(name, null,
                                union + " member must be a reference or an object schema");
                    }
                }
                if (node.has("properties")) {
                    members.add(new Member(null, node));
                }
                return new Shape(ShapeKind.UNION, members, null);
            }
            if (isObjectSchema(node)) {
                return new Shape(ShapeKind.OBJECT, List.of(new Member(null, node)), null);
            }
            FieldKind scalar = scalarKind(node);
            if (scalar != null) {
                return new Shape(ShapeKind.VALUE, List.of(), scalar);
            }
            throw SchemaException.unsupportedCombinator(name, null, "unrecognized definition shape");
        }

        private String refTarget(String owner, JsonNode ref) throws SchemaException {
            if (!ref.isTextual()) {
                throw SchemaException.malformedSchema("$ref in " + owner + " is not a string");
            }
            String target = referenceName(ref.asText());
            if (!raw.containsKey(target)) {
                throw SchemaException.unresolvedReference(owner, ref.asText());
            }
            return target;
        }

        // =====================================================================
        // Merging
        // =====================================================================

        private SchemaDefinition build(String name, Shape shape) throws SchemaException {
            Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
            String discriminator = null;

            for (Member member : shape.members()) {
                if (member.supertype() != null) {
                    for (FieldDescriptor inherited : resolved.get(member.supertype()).fields().values()) {
                        merge(name, fields, inherited);
                    }
                    continue;
                }
                JsonNode properties = member.inline().path("properties");
                if (properties.isMissingNode()) {
                    continue;
                }
                if (!properties.isObject()) {
                    throw SchemaException.malformedSchema("properties of " + name + " must be an object");
                }
                Set<String> required = requiredOf(member.inline());
                Iterator<Map.Entry<String, JsonNode>> it = properties.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> property = it.next();
                    merge(name, fields, classifyField(name, property.getKey(), property.getValue(),
                            required.contains(property.getKey())));
                }
                if (discriminator == null) {
                    discriminator = discriminatorOf(properties);
                }
            }

            SchemaDefinition.Kind kind = SchemaDefinition.Kind.OBJECT;
            FieldKind valueKind = null;
            if (shape.kind() == ShapeKind.VALUE) {
                kind = SchemaDefinition.Kind.VALUE;
                valueKind = shape.valueKind();
            } else if (shape.kind() == ShapeKind.ALIAS) {
                SchemaDefinition target = resolved.get(shape.supertypes().get(0));
                kind = target.kind();
                valueKind = target.valueKind();
            }
            return new SchemaDefinition(name, discriminator != null ? discriminator : name, kind, valueKind,
                    fields, shape.supertypes());
        }

        private void merge(String owner, Map<String, FieldDescriptor> fields, FieldDescriptor field) {
            FieldDescriptor existing = fields.putIfAbsent(field.name(), field);
            if (existing != null && existing.kind() != field.kind()) {
                LOG.debug("{}.{}: keeping {} over {}", owner, field.name(), existing.kind(), field.kind());
            }
        }

        // =====================================================================
        // Property classification
        // =====================================================================

        private FieldDescriptor classifyField(String owner, String fieldName, JsonNode node, boolean required)
                throws SchemaException {
            ValueShape shape = classifyValue(owner, fieldName, node);
            boolean nullable = !required || shape.nullable();
            if (shape.kind() == FieldKind.REFERENCE) {
                return FieldDescriptor.reference(fieldName, shape.target(), nullable, shape.many());
            }
            return FieldDescriptor.scalar(fieldName, shape.kind(), nullable);
        }

        private ValueShape classifyValue(String owner, String field, JsonNode node) throws SchemaException {
            if (!node.isObject()) {
                throw SchemaException.unsupportedCombinator(owner, field, "property schema must be an object");
            }
            if (node.has("$ref")) {
                String target = refTarget(owner, node.get("$ref"));
                FieldKind valueKind = valueKindOf(target);
                return valueKind != null
                        ? new ValueShape(valueKind, null, false, false)
                        : new ValueShape(FieldKind.REFERENCE, target, false, false);
            }
            String union = node.has("oneOf") ? "oneOf" : node.has("anyOf") ? "anyOf" : null;
            if (union != null) {
                return classifyUnion(owner, field, arrayOf(owner, node.get(union), union));
            }
            if (node.has("allOf")) {
                JsonNode members = arrayOf(owner, node.get("allOf"), "allOf");
                if (members.size() == 1) {
                    return classifyValue(owner, field, members.get(0));
                }
                throw SchemaException.unsupportedCombinator(owner, field, "allOf with several members");
            }
            if (node.has("not") || node.has("if")) {
                throw SchemaException.unsupportedCombinator(owner, field, "'not' and 'if' are not supported");
            }

            JsonNode type = node.get("type");
            if (type != null) {
                boolean nullable = false;
                String typeName = null;
                if (type.isTextual()) {
                    typeName = type.asText();
                } else if (type.isArray()) {
                    for (JsonNode t : type) {
                        if ("null".equals(t.asText())) {
                            nullable = true;
                        } else if (typeName == null) {
                            typeName = t.asText();
                        } else {
                            throw SchemaException.unsupportedCombinator(owner, field, "several types " + type);
                        }
                    }
                }
                if (typeName == null) {
                    throw SchemaException.unsupportedCombinator(owner, field, "type " + type + " carries no value");
                }
                FieldKind kind = FieldKind.ofJsonType(typeName);
                if (kind == null) {
                    throw SchemaException.unsupportedCombinator(owner, field, "unknown type '" + typeName + "'");
                }
                if (kind == FieldKind.ARRAY && node.path("items").isObject()) {
                    ValueShape item = classifyValue(owner, field, node.get("items"));
                    if (item.kind() == FieldKind.REFERENCE) {
                        return new ValueShape(FieldKind.REFERENCE, item.target(), nullable, true);
                    }
                }
                return new ValueShape(kind, null, nullable, false);
            }
            if (node.has("properties")) {
                return new ValueShape(FieldKind.OBJECT, null, false, false);
            }
            FieldKind constant = scalarKind(node);
            if (constant != null) {
                return new ValueShape(constant, null, false, false);
            }
            throw SchemaException.unsupportedCombinator(owner, field, "property schema without a type");
        }

        private ValueShape classifyUnion(String owner, String field, JsonNode alternatives) throws SchemaException {
            boolean nullable = false;
            List<ValueShape> shapes = new ArrayList<>();
            for (JsonNode alternative : alternatives) {
                if (isNullSchema(alternative)) {
                    nullable = true;
                } else {
                    shapes.add(classifyValue(owner, field, alternative));
                }
            }
            if (shapes.isEmpty()) {
                throw SchemaException.unsupportedCombinator(owner, field, "union allows only null");
            }

            ValueShape first = shapes.get(0);
            boolean sameKind = true;
            boolean sameTarget = true;
            boolean many = false;
            for (ValueShape shape : shapes) {
                sameKind &= shape.kind() == first.kind();
                sameTarget &= Objects.equals(shape.target(), first.target());
                many |= shape.many();
            }
            if (!sameKind) {
                throw SchemaException.unsupportedCombinator(owner, field, "union of different value kinds");
            }
            if (first.kind() == FieldKind.REFERENCE) {
                return new ValueShape(FieldKind.REFERENCE, sameTarget ? first.target() : null, nullable, many);
            }
            return new ValueShape(first.kind(), null, nullable, false);
        }

        /** Scalar kind of a value definition, following aliases; {@code null} for object-like definitions. */
        private FieldKind valueKindOf(String name) throws SchemaException {
            Set<String> seen = new LinkedHashSet<>();
            String current = name;
            while (seen.add(current)) {
                Shape shape = shape(current);
                if (shape.kind() == ShapeKind.VALUE) {
                    return shape.valueKind();
                }
                if (shape.kind() != ShapeKind.ALIAS) {
                    return null;
                }
                current = shape.supertypes().get(0);
            }
            List<String> chain = new ArrayList<>(seen);
            List<String> cycle = new ArrayList<>(chain.subList(chain.indexOf(current), chain.size()));
            cycle.add(current);
            throw SchemaException.cyclicInheritance(cycle);
        }
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static JsonNode arrayOf(String owner, JsonNode node, String keyword) throws SchemaException {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw SchemaException.malformedSchema(keyword + " in " + owner + " must be a non-empty array");
        }
        return node;
    }

    private static boolean isObjectSchema(JsonNode node) {
        return "object".equals(node.path("type").asText()) || node.has("properties");
    }

    private static boolean isNullSchema(JsonNode node) {
        return "null".equals(node.path("type").asText());
    }

    private static FieldKind scalarKind(JsonNode node) {
        JsonNode type = node.get("type");
        if (type != null) {
            String typeName = null;
            if (type.isTextual()) {
                typeName = type.asText();
            } else if (type.isArray()) {
                for (JsonNode t : type) {
                    if (!"null".equals(t.asText())) {
                        if (typeName != null) {
                            return null;
                        }
                        typeName = t.asText();
                    }
                }
            }
            FieldKind kind = typeName == null ? null : FieldKind.ofJsonType(typeName);
            return kind != null && kind.isScalar() ? kind : null;
        }
        JsonNode sample = node.has("const") ? node.get("const") : node.path("enum").path(0);
        if (sample.isTextual()) {
            return FieldKind.STRING;
        }
        if (sample.isBoolean()) {
            return FieldKind.BOOLEAN;
        }
        if (sample.isIntegralNumber()) {
            return FieldKind.INTEGER;
        }
        if (sample.isNumber()) {
            return FieldKind.NUMBER;
        }
        return null;
    }

    private static Set<String> requiredOf(JsonNode node) {
        Set<String> required = new HashSet<>();
        for (JsonNode name : node.path("required")) {
            required.add(name.asText());
        }
        return required;
    }

    private static String discriminatorOf(JsonNode properties) {
        JsonNode type = properties.path("@type");
        if (type.path("const").isTextual()) {
            return type.get("const").asText();
        }
        JsonNode values = type.path("enum");
        if (values.isArray() && values.size() == 1 && values.get(0).isTextual()) {
            return values.get(0).asText();
        }
        return null;
    }
}
