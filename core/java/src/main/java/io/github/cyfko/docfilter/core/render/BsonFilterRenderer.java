package io.github.cyfko.docfilter.core.render;

import io.github.cyfko.docfilter.core.ast.AndFilter;
import io.github.cyfko.docfilter.core.ast.ComparisonFilter;
import io.github.cyfko.docfilter.core.ast.ComparisonOperator;
import io.github.cyfko.docfilter.core.ast.ElemMatchFilter;
import io.github.cyfko.docfilter.core.ast.ExistsFilter;
import io.github.cyfko.docfilter.core.ast.FieldPath;
import io.github.cyfko.docfilter.core.ast.FilterNode;
import io.github.cyfko.docfilter.core.ast.FilterNodeVisitor;
import io.github.cyfko.docfilter.core.ast.InFilter;
import io.github.cyfko.docfilter.core.ast.MatchAllFilter;
import io.github.cyfko.docfilter.core.ast.MatchNoneFilter;
import io.github.cyfko.docfilter.core.ast.NotFilter;
import io.github.cyfko.docfilter.core.ast.NotInFilter;
import io.github.cyfko.docfilter.core.ast.OrFilter;
import io.github.cyfko.docfilter.core.ast.RegexFilter;
import io.github.cyfko.docfilter.core.ast.SizeFilter;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders a {@link FilterNode} tree as a MongoDB query document.
 *
 * <p><strong>Rendering rules:</strong></p>
 * <ul>
 *   <li>field filters: {@code { "a.b": { <operator>: <value> } } }; equality with a non-document
 *       value uses the short form {@code { "a.b": <value> } }</li>
 *   <li>{@code and}/{@code or}: {@code { $and: [...] } } / {@code { $or: [...] } }</li>
 *   <li>{@code not} of a single-field filter: {@code { "a.b": { $not: {...} } } }; of anything
 *       else: {@code { $nor: [ {...} ] } }</li>
 *   <li>match everything: {@code {}}; match nothing: {@code { "_id": { $type: -1 } } }</li>
 * </ul>
 * <p>
 * Inside {@code $elemMatch}, filters on the {@linkplain FieldPath#empty() empty path} apply to the
 * element itself and are rendered as bare operator documents, conjunctions being merged:
 * {@code { tags: { $elemMatch: { $gt: 1, $lt: 5 } } } }.
 * </p>
 *
 * <pre>{@code
 * BsonDocument query = BsonFilterRenderer.render(filter);
 * String json = BsonFilterRenderer.toJson(filter);   // {"Tags.red": {"$exists": true}}
 * }</pre>
 *
 * @since 1.0.0
 */
public final class BsonFilterRenderer implements FilterNodeVisitor<BsonDocument> {

    private static final BsonFilterRenderer INSTANCE = new BsonFilterRenderer();

    private BsonFilterRenderer() {
    }

    /**
     * Renders a filter as a query document.
     *
     * @param filter the filter
     * @return a new, mutable query document
     */
    public static BsonDocument render(FilterNode filter) {
        Objects.requireNonNull(filter, "filter");
        return filter.accept(INSTANCE);
    }

    /**
     * Renders a filter as relaxed extended JSON.
     *
     * @param filter the filter
     * @return the JSON text
     */
    public static String toJson(FilterNode filter) {
        return render(filter).toJson();
    }

    /**
     * Tells whether a filter mentions the current array element itself, i.e. contains a field
     * filter on the empty path outside any nested {@code $elemMatch}.
     *
     * @param filter the filter
     * @return {@code true} if the empty path is referenced
     */
    public static boolean referencesCurrentElement(FilterNode filter) {
        if (filter instanceof AndFilter and) {
            return and.filters().stream().anyMatch(BsonFilterRenderer::referencesCurrentElement);
        }
        if (filter instanceof OrFilter or) {
            return or.filters().stream().anyMatch(BsonFilterRenderer::referencesCurrentElement);
        }
        if (filter instanceof NotFilter not) {
            return referencesCurrentElement(not.filter());
        }
        FieldPath field = fieldOf(filter);
        return field != null && field.isEmpty();
    }

    /**
     * Tells whether a filter can be rendered as a bare operator document applied to the current
     * array element, e.g. {@code { $gt: 1, $lt: 5 } }.
     *
     * @param filter the filter
     * @return {@code true} if {@code filter} is expressible on the element itself
     */
    public static boolean isElementOperatorFilter(FilterNode filter) {
        return elementOperators(filter).isPresent();
    }

    @Override
    public BsonDocument visitExists(ExistsFilter filter) {
        return fieldDocument(filter.field(), operators(filter));
    }

    @Override
    public BsonDocument visitComparison(ComparisonFilter filter) {
        if (filter.operator() == ComparisonOperator.EQ && !filter.field().isEmpty() && !filter.value().isDocument()) {
            return new BsonDocument(filter.field().dotted(), filter.value());
        }
        return fieldDocument(filter.field(), operators(filter));
    }

    @Override
    public BsonDocument visitIn(InFilter filter) {
        return fieldDocument(filter.field(), operators(filter));
    }

    @Override
    public BsonDocument visitNotIn(NotInFilter filter) {
        return fieldDocument(filter.field(), operators(filter));
    }

    @Override
    public BsonDocument visitRegex(RegexFilter filter) {
        return fieldDocument(filter.field(), operators(filter));
    }

    @Override
    public BsonDocument visitSize(SizeFilter filter) {
        return fieldDocument(filter.field(), operators(filter));
    }

    @Override
    public BsonDocument visitElemMatch(ElemMatchFilter filter) {
        return fieldDocument(filter.field(), operators(filter));
    }

    @Override
    public BsonDocument visitAnd(AndFilter filter) {
        return new BsonDocument("$and", renderAll(filter.filters()));
    }

    @Override
    public BsonDocument visitOr(OrFilter filter) {
        return new BsonDocument("$or", renderAll(filter.filters()));
    }

    @Override
    public BsonDocument visitNot(NotFilter filter) {
        FilterNode negated = filter.filter();
        FieldPath field = fieldOf(negated);
        if (field != null) {
            return fieldDocument(field, new BsonDocument("$not", operators(negated)));
        }
        return new BsonDocument("$nor", new BsonArray(List.of(render(negated))));
    }

    @Override
    public BsonDocument visitMatchAll(MatchAllFilter filter) {
        return new BsonDocument();
    }

    @Override
    public BsonDocument visitMatchNone(MatchNoneFilter filter) {
        return new BsonDocument("_id", new BsonDocument("$type", new BsonInt32(-1)));
    }

    private static BsonArray renderAll(List<FilterNode> filters) {
        BsonArray array = new BsonArray();
        for (FilterNode child : filters) {
            array.add(render(child));
        }
        return array;
    }

    private static BsonDocument fieldDocument(FieldPath field, BsonDocument operators) {
        return field.isEmpty() ? operators : new BsonDocument(field.dotted(), operators);
    }

    /**
     * Returns the field of a single-field filter, or {@code null} for combinators.
     */
    private static FieldPath fieldOf(FilterNode filter) {
        if (filter instanceof ExistsFilter exists) return exists.field();
        if (filter instanceof ComparisonFilter comparison) return comparison.field();
        if (filter instanceof InFilter in) return in.field();
        if (filter instanceof NotInFilter notIn) return notIn.field();
        if (filter instanceof RegexFilter regex) return regex.field();
        if (filter instanceof SizeFilter size) return size.field();
        if (filter instanceof ElemMatchFilter elemMatch) return elemMatch.field();
        return null;
    }

    /**
     * Returns the operator document of a single-field filter.
     */
    private static BsonDocument operators(FilterNode filter) {
        if (filter instanceof ExistsFilter exists) {
            return new BsonDocument("$exists", BsonBoolean.valueOf(exists.exists()));
        }
        if (filter instanceof ComparisonFilter comparison) {
            return new BsonDocument(comparison.operator().getOperatorName(), comparison.value());
        }
        if (filter instanceof InFilter in) {
            return new BsonDocument("$in", new BsonArray(in.values()));
        }
        if (filter instanceof NotInFilter notIn) {
            return new BsonDocument("$nin", new BsonArray(notIn.values()));
        }
        if (filter instanceof RegexFilter regex) {
            BsonDocument document = new BsonDocument("$regex", new BsonString(regex.pattern()));
            if (!regex.options().isEmpty()) {
                document.append("$options", new BsonString(regex.options()));
            }
            return document;
        }
        if (filter instanceof SizeFilter size) {
            return new BsonDocument("$size", new BsonInt32(size.size()));
        }
        if (filter instanceof ElemMatchFilter elemMatch) {
            FilterNode element = elemMatch.filter();
            BsonDocument elementDocument = referencesCurrentElement(element)
                    ? elementOperators(element).orElseGet(() -> render(element))
                    : render(element);
            return new BsonDocument("$elemMatch", elementDocument);
        }
        throw new IllegalArgumentException("Not a single-field filter: " + filter.getClass().getSimpleName());
    }

    private static Optional<BsonDocument> elementOperators(FilterNode filter) {
        if (filter instanceof NotFilter not) {
            if (not.filter() instanceof NotFilter doubleNegation) {
                return elementOperators(doubleNegation.filter());
            }
            return elementOperators(not.filter()).map(negated -> new BsonDocument("$not", negated));
        }
        if (filter instanceof AndFilter and) {
            BsonDocument merged = new BsonDocument();
            for (FilterNode child : and.filters()) {
                Optional<BsonDocument> operators = elementOperators(child);
                if (operators.isEmpty()) {
                    return Optional.empty();
                }
                for (Map.Entry<String, BsonValue> entry : operators.get().entrySet()) {
                    if (merged.containsKey(entry.getKey())) {
                        return Optional.empty();
                    }
                    merged.append(entry.getKey(), entry.getValue());
                }
            }
            return Optional.of(merged);
        }
        FieldPath field = fieldOf(filter);
        if (field == null || !field.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(operators(filter));
    }
}
