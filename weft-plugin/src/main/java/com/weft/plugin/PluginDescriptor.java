package com.weft.plugin;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Static metadata for one plugin: identity, human description, category and tags used for
 * discovery, and the capability types it consumes and produces, used to build chains.
 * Immutable once registered. Manifests (JSON) bind to this type through {@link PluginManifestLoader}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PluginDescriptor {

    public static final String DEFAULT_CATEGORY = "general";
    public static final String DEFAULT_VERSION = "1.0.0";

    private final String identity;
    private final String description;
    private final String category;
    private final List<String> tags;
    private final List<String> capabilities;
    private final String version;
    private final Set<String> declaredInputTypes;
    private final Set<String> declaredOutputTypes;
    private final Set<String> collaboratesWith;
    private final double chainPriority;
    private final boolean autoChainEligible;

    @JsonCreator
    public PluginDescriptor(
            @JsonProperty("id") String identity,
            @JsonProperty("description") String description,
            @JsonProperty("category") String category,
            @JsonProperty("tags") List<String> tags,
            @JsonProperty("capabilities") List<String> capabilities,
            @JsonProperty("version") String version,
            @JsonProperty("inputTypes") Collection<String> declaredInputTypes,
            @JsonProperty("outputTypes") Collection<String> declaredOutputTypes,
            @JsonProperty("collaboratesWith") Collection<String> collaboratesWith,
            @JsonProperty("chainPriority") Double chainPriority,
            @JsonProperty("autoChain") Boolean autoChainEligible) {
        String id = Objects.requireNonNull(identity, "identity").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Plugin identity must be non-blank");
        }
        this.identity = id;
        this.description = description != null ? description.trim() : "";
        this.category = category != null && !category.isBlank() ? category.trim() : DEFAULT_CATEGORY;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
        this.version = version != null && !version.isBlank() ? version.trim() : DEFAULT_VERSION;
        this.declaredInputTypes = orderedCopy(declaredInputTypes);
        this.declaredOutputTypes = orderedCopy(declaredOutputTypes);
        this.collaboratesWith = orderedCopy(collaboratesWith);
        this.chainPriority = chainPriority != null ? chainPriority : 0.0;
        this.autoChainEligible = autoChainEligible != null && autoChainEligible;
    }

    private static Set<String> orderedCopy(Collection<String> values) {
        if (values == null || values.isEmpty()) return Set.of();
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return Collections.unmodifiableSet(out);
    }

    public static Builder builder(String identity) {
        return new Builder(identity);
    }

    @JsonProperty("id")
    public String getIdentity() {
        return identity;
    }

    public String getDescription() {
        return description;
    }

    /** Grouping used by chain suggestions; {@value #DEFAULT_CATEGORY} when not declared. */
    public String getCategory() {
        return category;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public String getVersion() {
        return version;
    }

    /** Capability types this plugin consumes. Empty = no preconditions. Insertion-ordered, unmodifiable. */
    @JsonProperty("inputTypes")
    public Set<String> getDeclaredInputTypes() {
        return declaredInputTypes;
    }

    /** Capability types this plugin produces. Insertion-ordered, unmodifiable. */
    @JsonProperty("outputTypes")
    public Set<String> getDeclaredOutputTypes() {
        return declaredOutputTypes;
    }

    public Set<String> getCollaboratesWith() {
        return collaboratesWith;
    }

    /** Tie-break weight; higher runs earlier when otherwise unconstrained. */
    public double getChainPriority() {
        return chainPriority;
    }

    /** Whether the plugin may seed a chain even though it declares inputs. */
    @JsonProperty("autoChain")
    public boolean isAutoChainEligible() {
        return autoChainEligible;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginDescriptor that = (PluginDescriptor) o;
        return Double.compare(that.chainPriority, chainPriority) == 0
                && autoChainEligible == that.autoChainEligible
                && identity.equals(that.identity)
                && description.equals(that.description)
                && category.equals(that.category)
                && tags.equals(that.tags)
                && capabilities.equals(that.capabilities)
                && version.equals(that.version)
                && declaredInputTypes.equals(that.declaredInputTypes)
                && declaredOutputTypes.equals(that.declaredOutputTypes)
                && collaboratesWith.equals(that.collaboratesWith);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, description, category, tags, capabilities, version,
                declaredInputTypes, declaredOutputTypes, collaboratesWith, chainPriority, autoChainEligible);
    }

    @Override
    public String toString() {
        return "PluginDescriptor{" + identity + ", in=" + declaredInputTypes + ", out=" + declaredOutputTypes + "}";
    }

    public static final class Builder {
        private final String identity;
        private String description;
        private String category;
        private List<String> tags = List.of();
        private List<String> capabilities = List.of();
        private String version;
        private Set<String> inputTypes = Set.of();
        private Set<String> outputTypes = Set.of();
        private Set<String> collaboratesWith = Set.of();
        private double chainPriority;
        private boolean autoChainEligible;

        private Builder(String identity) {
            this.identity = identity;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = List.of(tags);
            return this;
        }

        public Builder capabilities(String... capabilities) {
            this.capabilities = List.of(capabilities);
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder inputTypes(String... types) {
            this.inputTypes = new LinkedHashSet<>(List.of(types));
            return this;
        }

        public Builder outputTypes(String... types) {
            this.outputTypes = new LinkedHashSet<>(List.of(types));
            return this;
        }

        public Builder collaboratesWith(String... identities) {
            this.collaboratesWith = new LinkedHashSet<>(List.of(identities));
            return this;
        }

        public Builder chainPriority(double chainPriority) {
            this.chainPriority = chainPriority;
            return this;
        }

        public Builder autoChainEligible(boolean autoChainEligible) {
            this.autoChainEligible = autoChainEligible;
            return this;
        }

        public PluginDescriptor build() {
            return new PluginDescriptor(identity, description, category, tags, capabilities, version,
                    inputTypes, outputTypes, collaboratesWith, chainPriority, autoChainEligible);
        }
    }
}
