package org.wikidata.query.rdf.entitystore.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Core metadata of an entity: labels, aliases, description, types, popularity, category and NER types.
 * Build it with {@link #builder(long, String)}.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public final class ItemRecord extends DerivedRecord {

    public static final String DESCRIPTION_FIELD = "description";
    public static final String LABELS_FIELD = "labels";
    public static final String ALIASES_FIELD = "aliases";
    public static final String TYPES_FIELD = "types";
    public static final String POPULARITY_FIELD = "popularity";
    public static final String CATEGORY_FIELD = "category";
    public static final String NER_TYPE_FIELD = "NERtype";
    public static final String URLS_FIELD = "URLs";
    public static final String EXTENDED_TYPES_FIELD = "extended_WDtypes";
    public static final String EXPLICIT_TYPES_FIELD = "explicit_WDtypes";

    private final String description;
    private final ImmutableMap<String, String> labels;
    private final ImmutableMap<String, ImmutableList<String>> aliases;
    private final TypeSet types;
    private final int popularity;
    private final EntityCategory category;
    private final ImmutableSet<NerType> nerTypes;
    private final ImmutableMap<String, String> urls;
    private final ImmutableSet<String> extendedTypes;
    private final ImmutableList<String> explicitTypes;

    private ItemRecord(Builder builder) {
        super(builder.sequence, builder.entity);
        this.description = builder.description;
        this.labels = ImmutableMap.copyOf(builder.labels);
        ImmutableMap.Builder<String, ImmutableList<String>> aliasesBuilder = ImmutableMap.builder();
        builder.aliases.forEach((language, values) -> aliasesBuilder.put(language, ImmutableList.copyOf(values)));
        this.aliases = aliasesBuilder.build();
        this.types = builder.types;
        this.popularity = builder.popularity;
        this.category = builder.category;
        this.nerTypes = ImmutableSet.copyOf(builder.nerTypes);
        this.urls = ImmutableMap.copyOf(builder.urls);
        this.extendedTypes = ImmutableSet.copyOf(builder.extendedTypes);
        this.explicitTypes = ImmutableList.copyOf(builder.explicitTypes);
    }

    public static Builder builder(long sequence, String entity) {
        return new Builder(sequence, entity);
    }

    @Override
    public RecordKind getKind() {
        return RecordKind.ITEMS;
    }

    public String getDescription() {
        return description;
    }

    public ImmutableMap<String, String> getLabels() {
        return labels;
    }

    public ImmutableMap<String, ImmutableList<String>> getAliases() {
        return aliases;
    }

    public TypeSet getTypes() {
        return types;
    }

    public int getPopularity() {
        return popularity;
    }

    public EntityCategory getCategory() {
        return category;
    }

    public ImmutableSet<NerType> getNerTypes() {
        return nerTypes;
    }

    public ImmutableMap<String, String> getUrls() {
        return urls;
    }

    public ImmutableSet<String> getExtendedTypes() {
        return extendedTypes;
    }

    public ImmutableList<String> getExplicitTypes() {
        return explicitTypes;
    }

    @Override
    protected void addFields(Map<String, Object> document) {
        document.put(DESCRIPTION_FIELD, description);
        document.put(LABELS_FIELD, new LinkedHashMap<>(labels));
        Map<String, List<String>> aliasesDocument = new LinkedHashMap<>();
        aliases.forEach((language, values) -> aliasesDocument.put(language, new ArrayList<>(values)));
        document.put(ALIASES_FIELD, aliasesDocument);
        document.put(TYPES_FIELD, types.toDocument());
        document.put(POPULARITY_FIELD, popularity);
        document.put(CATEGORY_FIELD, category.value());
        List<String> ner = new ArrayList<>();
        for (NerType nerType : nerTypes) ner.add(nerType.name());
        document.put(NER_TYPE_FIELD, ner);
        document.put(URLS_FIELD, new LinkedHashMap<>(urls));
        document.put(EXTENDED_TYPES_FIELD, new ArrayList<>(extendedTypes));
        document.put(EXPLICIT_TYPES_FIELD, new ArrayList<>(explicitTypes));
    }

    /**
     * Collects the item fields. Everything but the sequence index and the entity identifier has an empty default.
     */
    public static final class Builder {
        private final long sequence;
        private final String entity;
        private String description = "";
        private Map<String, String> labels = ImmutableMap.of();
        private Map<String, ? extends Collection<String>> aliases = ImmutableMap.of();
        private TypeSet types = new TypeSet(ImmutableList.of());
        private int popularity = 1;
        private EntityCategory category = EntityCategory.ENTITY;
        private Collection<NerType> nerTypes = ImmutableList.of();
        private Map<String, String> urls = ImmutableMap.of();
        private Collection<String> extendedTypes = ImmutableList.of();
        private Collection<String> explicitTypes = ImmutableList.of();

        private Builder(long sequence, String entity) {
            this.sequence = sequence;
            this.entity = Objects.requireNonNull(entity, "entity");
        }

        public Builder description(String description) {
            this.description = Objects.requireNonNull(description, "description");
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder aliases(Map<String, ? extends Collection<String>> aliases) {
            this.aliases = aliases;
            return this;
        }

        public Builder types(TypeSet types) {
            this.types = types;
            return this;
        }

        public Builder popularity(int popularity) {
            if (popularity < 1) throw new IllegalArgumentException("Popularity must be at least 1, got " + popularity);
            this.popularity = popularity;
            return this;
        }

        public Builder category(EntityCategory category) {
            this.category = Objects.requireNonNull(category, "category");
            return this;
        }

        public Builder nerTypes(Collection<NerType> nerTypes) {
            this.nerTypes = nerTypes;
            return this;
        }

        public Builder urls(Map<String, String> urls) {
            this.urls = urls;
            return this;
        }

        public Builder extendedTypes(Collection<String> extendedTypes) {
            this.extendedTypes = extendedTypes;
            return this;
        }

        public Builder explicitTypes(Collection<String> explicitTypes) {
            this.explicitTypes = explicitTypes;
            return this;
        }

        public ItemRecord build() {
            return new ItemRecord(this);
        }
    }
}
