package com.schemajenerator.utils.jsonschema.draft202012;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schemajenerator.utils.jsonschema.IBuildableSchemaType;
import com.schemajenerator.utils.jsonschema.JsonSchemaType;
import com.schemajenerator.utils.jsonschema.draft202012.SchemaBuilder.IArraySchemaBuilder;
import java.util.Objects;

/** Implementation of IArraySchemaBuilder for building array-type schemas. */
final class ArrayBuilderImpl extends AbstractSchemaBuilderImpl<IArraySchemaBuilder>
    implements IArraySchemaBuilder {

  private static final String MIN_ITEMS = "minItems";
  private static final String MAX_ITEMS = "maxItems";
  private static final String UNIQUE_ITEMS = "uniqueItems";
  private static final String ITEMS = "items";

  ArrayBuilderImpl(ObjectMapper mapper) {
    super(JsonSchemaType.ARRAY, mapper);
  }

  @Override
  protected IArraySchemaBuilder self() {
    return this;
  }

  // Array-specific validation
  @Override
  public IArraySchemaBuilder minItems(int minItems) {
    if (minItems < 0) {
      throw new IllegalArgumentException("minItems cannot be negative: " + minItems);
    }
    schema.put(MIN_ITEMS, minItems);
    return this;
  }

  @Override
  public IArraySchemaBuilder maxItems(int maxItems) {
    if (maxItems < 0) {
      throw new IllegalArgumentException("maxItems cannot be negative: " + maxItems);
    }
    schema.put(MAX_ITEMS, maxItems);
    return this;
  }

  @Override
  public IArraySchemaBuilder uniqueItems(boolean uniqueItems) {
    schema.put(UNIQUE_ITEMS, uniqueItems);
    return this;
  }

  @Override
  public IArraySchemaBuilder items(ObjectNode itemSchema) {
    Objects.requireNonNull(itemSchema, "Item schema cannot be null for array type");
    schema.set(ITEMS, itemSchema);
    return this;
  }

  @Override
  public IArraySchemaBuilder items(IBuildableSchemaType itemSchemaBuilder) {
    Objects.requireNonNull(itemSchemaBuilder, "Item schema builder cannot be null");
    return items(itemSchemaBuilder.build().getNode());
  }

  @Override
  public IArraySchemaBuilder anyItems() {
    return items(mapper.createObjectNode());
  }
}
