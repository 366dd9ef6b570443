package com.architecture.memory.archscraper.service.template;

import com.architecture.memory.archscraper.model.ArchitectureDocument;
import com.architecture.memory.archscraper.model.FileEntry;
import com.architecture.memory.archscraper.model.ParsedTemplate;
import com.architecture.memory.archscraper.model.SourceSpec;
import com.architecture.memory.archscraper.model.TemplateMetadata;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ArchitectureNormalizerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final SourceSpec SPEC = new SourceSpec("Azure", "azure-quickstart-templates", "quickstarts");

    private final ArchitectureIdGenerator idGenerator = new ArchitectureIdGenerator();
    private final ArchitectureNormalizer normalizer = new ArchitectureNormalizer(
            idGenerator, CLOCK, "https://github.com", "HEAD",
            new TemplateCandidateFilter(List.of("azuredeploy.json", "main.json", "template.json"), false, true));

    @Test
    void normalize_buildsDocumentFromTemplate() {
        FileEntry candidate = FileEntry.file("quickstarts/microsoft.web/webapp-basic/azuredeploy.json", "u");

        ArchitectureDocument document = normalizer.normalize(SPEC, candidate, template(
                "Microsoft.Web/sites", "Microsoft.Web/serverfarms", "Microsoft.Web/sites"));

        assertThat(document.getId()).hasSize(64);
        assertThat(document.getName()).isEqualTo("webapp-basic");
        assertThat(document.getDisplayName()).isEqualTo("webapp-basic");
        assertThat(document.getResourceTypes()).containsExactly("Microsoft.Web/serverfarms", "Microsoft.Web/sites");
        assertThat(document.getResourceCount()).isEqualTo(2);
        assertThat(document.getParameterNames()).containsExactly("location", "sku");
        assertThat(document.getOutputNames()).containsExactly("siteUrl");
        assertThat(document.getTemplateFile()).isEqualTo("azuredeploy.json");
        assertThat(document.getSourceUrl()).isEqualTo(
                "https://github.com/Azure/azure-quickstart-templates/blob/HEAD/quickstarts/microsoft.web/webapp-basic/azuredeploy.json");
        assertThat(document.getScrapedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 0));
    }

    @Test
    void normalize_deduplicatesResourceTypesIgnoringCase() {
        FileEntry candidate = FileEntry.file("quickstarts/app/azuredeploy.json", "u");

        ArchitectureDocument document = normalizer.normalize(SPEC, candidate, template(
                "Microsoft.Storage/storageAccounts", "microsoft.storage/storageaccounts", "Microsoft.Network/virtualNetworks"));

        assertThat(document.getResourceTypes())
                .containsExactly("Microsoft.Network/virtualNetworks", "Microsoft.Storage/storageAccounts");
        assertThat(document.getResourceCount()).isEqualTo(document.getResourceTypes().size());
    }

    @Test
    void normalize_isDeterministicForSameInput() {
        FileEntry candidate = FileEntry.file("quickstarts/app/azuredeploy.json", "u");

        ArchitectureDocument first = normalizer.normalize(SPEC, candidate, template("A/b", "C/d"));
        ArchitectureDocument second = normalizer.normalize(SPEC, candidate, template("C/d", "A/b"));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void normalize_usesMetadataForDisplayNameAndDescription() {
        FileEntry candidate = FileEntry.file("quickstarts/app/azuredeploy.json", "u");
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("itemDisplayName", "Basic web app");
        TemplateMetadata metadata = TemplateMetadata.builder()
                .displayName("Basic web app")
                .description("Deploys a web app")
                .raw(raw)
                .build();

        ArchitectureDocument document = normalizer.normalize(SPEC, candidate, template("A/b"), metadata);

        assertThat(document.getName()).isEqualTo("app");
        assertThat(document.getDisplayName()).isEqualTo("Basic web app");
        assertThat(document.getDescription()).isEqualTo("Deploys a web app");
        assertThat(document.getMetadata()).containsEntry("itemDisplayName", "Basic web app");
    }

    @Test
    void deriveName_followsFileNameRules() {
        SourceSpec wholeRepo = new SourceSpec("Org", "my-templates", null);

        assertThat(normalizer.deriveName(wholeRepo, FileEntry.file("azuredeploy.json", "u"))).isEqualTo("my-templates");
        assertThat(normalizer.deriveName(wholeRepo, FileEntry.file("net/hub/Main.JSON", "u"))).isEqualTo("hub");
        assertThat(normalizer.deriveName(wholeRepo, FileEntry.file("net/hub-spoke.json", "u"))).isEqualTo("hub-spoke");
    }

    @Test
    void deriveName_treatsConfiguredTemplateFileNamesAsGeneric() {
        ArchitectureNormalizer custom = new ArchitectureNormalizer(idGenerator, CLOCK, "https://github.com", "HEAD",
                new TemplateCandidateFilter(List.of(" Deploy.json "), false, true));
        SourceSpec wholeRepo = new SourceSpec("Org", "my-templates", null);

        assertThat(custom.deriveName(wholeRepo, FileEntry.file("net/hub/deploy.json", "u"))).isEqualTo("hub");
        assertThat(custom.deriveName(wholeRepo, FileEntry.file("net/hub/azuredeploy.json", "u"))).isEqualTo("azuredeploy");
    }

    @Test
    void normalize_dropsDollarPrefixedMetadataKeys() {
        FileEntry candidate = FileEntry.file("quickstarts/app/azuredeploy.json", "u");
        Map<String, Object> nested = new LinkedHashMap<>();
        nested.put("$ref", "#/definitions/x");
        nested.put("kind", "sample");
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("$schema", "https://aka.ms/azure-quickstart-templates-metadata-schema#");
        raw.put("itemDisplayName", "Basic web app");
        raw.put("details", nested);
        raw.put("tags", List.of(Map.of("$id", "1", "name", "web")));
        TemplateMetadata metadata = TemplateMetadata.builder().raw(raw).build();

        ArchitectureDocument document = normalizer.normalize(SPEC, candidate, template("A/b"), metadata);

        assertThat(document.getMetadata()).containsOnlyKeys("itemDisplayName", "details", "tags");
        assertThat(document.getMetadata().get("details")).isEqualTo(Map.of("kind", "sample"));
        assertThat(document.getMetadata().get("tags")).isEqualTo(List.of(Map.of("name", "web")));
        assertThat(raw).containsKey("$schema");
    }

    @Test
    void idGenerator_ignoresOwnerAndRepoCase() {
        assertThat(idGenerator.generate("Azure", "Repo", "a/azuredeploy.json"))
                .isEqualTo(idGenerator.generate("azure", "REPO", "a/azuredeploy.json"))
                .isNotEqualTo(idGenerator.generate("azure", "repo", "A/azuredeploy.json"));
    }

    private static ParsedTemplate template(String... types) {
        ParsedTemplate template = ParsedTemplate.builder().build();
        for (String type : types) {
            template.getResources().add(ParsedTemplate.Resource.builder().type(type).name("r").build());
        }
        template.getParameters().put("location", ParsedTemplate.Parameter.builder().type("string").build());
        template.getParameters().put("sku", ParsedTemplate.Parameter.builder().type("string").build());
        template.getOutputs().put("siteUrl", ParsedTemplate.Output.builder().type("string").build());
        return template;
    }
}
