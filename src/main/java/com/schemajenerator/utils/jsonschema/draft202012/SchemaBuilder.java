package com.schemajenerator.utils.jsonschema.draft202012;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemajenerator.utils.JsonMapperHolder;
import com.schemajenerator.utils.jsonschema.IBuildableSchemaType;
import com.schemajenerator.utils.jsonschema.StringFormatType;
import com.schemajenerator.utils.jsonschema.draft202012.traits.ICommonMetadata;
import com.schemajenerator.utils.jsonschema.draft202012.traits.IComposition;

import java.math.BigInteger;
import java.util.List;

/**
 * Builder for the JSON Schema 2020-12 documents emitted by the schema
 * generators.
 *
 * <p>
 * Only the vocabulary the generators produce is modelled: type, properties,
 * required, additionalProperties, minProperties, items, oneOf, minItems,
 * maxItems, uniqueItems, minLength, maxLength, format, pattern, minimum,
 * maximum, multipleOf, examples, title, description and $schema.
 * </p>
 *
 * <p>
 * Example Usage:
 * </p>
 *
 * <pre>{@code
 * JsonSchema userSchema = SchemaBuilder.object()
 * 		.schemaUri(SchemaBuilder.DRAFT_2020_12)
 * 		.property("id", SchemaBuilder.integer().minimum(1), true)
 * 		.property("email", SchemaBuilder.string().format(StringFormatType.EMAIL))
 * 		.additionalProperties(false)
 * 		.build();
 * }</pre>
 *
 * @see <a href=
 *      "https://json-schema.org/draft/2020-12/json-schema-validation">JSON
 *      Schema 2020-12 Validation</a>
 */
public class SchemaBuilder {

	/** The {@code $schema} URI of the 2020-12 meta-schema. */
	public static final String DRAFT_2020_12 = "https://json-schema.org/draft/2020-12/schema";

	static final ObjectMapper DEFAULT_MAPPER = JsonMapperHolder.getMapper();

	private SchemaBuilder() {
	}

	// ========== Type-Specific Builder Interfaces ==========

	/** State interface for building a 'string' schema. */
	public interface IStringSchemaBuilder extends IBuildableSchemaType,
			ICommonMetadata<IStringSchemaBuilder> {

		IStringSchemaBuilder minLength(int minLength);

		IStringSchemaBuilder maxLength(int maxLength);

		IStringSchemaBuilder pattern(String pattern);

		IStringSchemaBuilder format(StringFormatType format);
	}

	/** State interface for building a 'number' schema. */
	public interface INumberSchemaBuilder extends IBuildableSchemaType,
			ICommonMetadata<INumberSchemaBuilder> {

		INumberSchemaBuilder minimum(double minimum);

		INumberSchemaBuilder maximum(double maximum);
	}

	/** State interface for building an 'integer' schema. */
	public interface IIntegerSchemaBuilder extends IBuildableSchemaType,
			ICommonMetadata<IIntegerSchemaBuilder> {

		IIntegerSchemaBuilder minimum(BigInteger minimum);

		IIntegerSchemaBuilder maximum(BigInteger maximum);

		IIntegerSchemaBuilder minimum(long minimum);

		IIntegerSchemaBuilder maximum(long maximum);

		IIntegerSchemaBuilder multipleOf(long multipleOf);
	}

	/** State interface for building a 'boolean' schema. */
	public interface IBooleanSchemaBuilder extends IBuildableSchemaType,
			ICommonMetadata<IBooleanSchemaBuilder> {
	}

	/** State interface for building a 'null' schema. */
	public interface INullSchemaBuilder extends IBuildableSchemaType {
		// Null type has no keywords beyond its type
	}

	/** State interface for building an 'array' schema. */
	public interface IArraySchemaBuilder extends IBuildableSchemaType,
			ICommonMetadata<IArraySchemaBuilder> {

		IArraySchemaBuilder minItems(int minItems);

		IArraySchemaBuilder maxItems(int maxItems);

		IArraySchemaBuilder uniqueItems(boolean uniqueItems);

		IArraySchemaBuilder items(ObjectNode itemSchema);

		IArraySchemaBuilder items(IBuildableSchemaType itemSchemaBuilder);

		/** Sets {@code items} to the empty schema {@code {}}, which accepts anything. */
		IArraySchemaBuilder anyItems();
	}

	/**
	 * Object schema builder. The {@code properties} keyword is always emitted,
	 * even when no property is added.
	 */
	public interface IObjectSchemaBuilder extends IBuildableSchemaType,
			ICommonMetadata<IObjectSchemaBuilder> {

		IObjectSchemaBuilder property(String name, ObjectNode propertySchema, boolean required);

		IObjectSchemaBuilder property(String name, IBuildableSchemaType propertySchemaBuilder);

		IObjectSchemaBuilder property(String name, IBuildableSchemaType propertySchemaBuilder, boolean required);

		IObjectSchemaBuilder requiredProperty(String name);

		IObjectSchemaBuilder minProperties(int minProperties);

		IObjectSchemaBuilder additionalProperties(boolean allowed);

		/** Sets the {@code $schema} keyword, declaring the dialect of the document. */
		IObjectSchemaBuilder schemaUri(String uri);
	}

	/** State interface for a schema without a {@code type}, carrying only composition keywords. */
	public interface IUntypedSchemaBuilder extends IBuildableSchemaType,
			IComposition<IUntypedSchemaBuilder> {
	}

	// ========== Factory Methods ==========

	public static IStringSchemaBuilder string() {
		return new StringBuilderImpl(DEFAULT_MAPPER);
	}

	public static INumberSchemaBuilder number() {
		return new NumberBuilderImpl(DEFAULT_MAPPER);
	}

	public static IIntegerSchemaBuilder integer() {
		return new IntegerBuilderImpl(DEFAULT_MAPPER);
	}

	public static IBooleanSchemaBuilder bool() {
		return new BooleanBuilderImpl(DEFAULT_MAPPER);
	}

	public static IArraySchemaBuilder array() {
		return new ArrayBuilderImpl(DEFAULT_MAPPER);
	}

	public static IObjectSchemaBuilder object() {
		return new ObjectBuilderImpl(DEFAULT_MAPPER);
	}

	public static INullSchemaBuilder nul() {
		return new NullBuilderImpl(DEFAULT_MAPPER);
	}

	// ========== Composition-Only Factory Methods (No Base Type) ==========

	/**
	 * Creates a schema with ONLY a oneOf constraint and NO base type.
	 * Use this for union types where data can be one of several different types.
	 *
	 * <pre>{@code
	 * JsonSchema schema = SchemaBuilder.oneOf(
	 * 		SchemaBuilder.integer(),
	 * 		SchemaBuilder.string()).build();
	 * // Generates: { "oneOf": [{ "type": "integer" }, { "type": "string" }] }
	 * }</pre>
	 *
	 * @param schemas Schemas where exactly one must match
	 * @return Untyped builder with oneOf constraint
	 */
	public static IUntypedSchemaBuilder oneOf(IBuildableSchemaType... schemas) {
		return new UntypedBuilderImpl(DEFAULT_MAPPER).oneOf(schemas);
	}

	/**
	 * List form of {@link #oneOf(IBuildableSchemaType...)}.
	 *
	 * @param schemas Schemas where exactly one must match
	 * @return Untyped builder with oneOf constraint
	 */
	public static IUntypedSchemaBuilder oneOf(List<? extends IBuildableSchemaType> schemas) {
		return new UntypedBuilderImpl(DEFAULT_MAPPER).oneOf(schemas);
	}
}
