package de.bsommerfeld.sysml.sql.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.sysml.sql.api.model.Branch;
import de.bsommerfeld.sysml.sql.api.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Navigates a SysML v2 API server: resolves a project and commit from the
 * user's selection and builds the element listing URL.
 *
 * <h3>Selection by name</h3>
 * Names are matched as prefixes, e.g. {@code Veh} selects
 * {@code Vehicle Model} if no other project starts with {@code Veh}. No
 * match, or more than one, is a {@link FetchException.Kind#SELECTION}
 * failure listing the candidates.
 *
 * <pre>
 * GET {base}/projects                          (project by name)
 * GET {base}/projects/{p}                      (default branch)
 * GET {base}/projects/{p}/branches[/{b}]       (branch by name / id)
 * GET {base}/projects/{p}/commits/{c}/elements (the model)
 * </pre>
 */
public class SysmlApiClient {

    private static final Logger LOG = LoggerFactory.getLogger(SysmlApiClient.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final URI baseUri;
    private final PaginatedFetcher fetcher;

    public SysmlApiClient(URI baseUri, PaginatedFetcher fetcher) {
        String base = baseUri.toString();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        this.baseUri = URI.create(base);
        this.fetcher = fetcher;
    }

    public ModelReference resolve(ProjectSelector projectSelector, CommitSelector commitSelector)
            throws FetchException, InterruptedException {
        Project matched = null;
        String projectId = projectSelector.projectId();
        if (projectId == null) {
            matched = findProject(projectSelector.namePrefix());
            projectId = matched.id();
        }
        LOG.debug("Using project {}", projectId);

        String commitId = switch (commitSelector.kind()) {
            case COMMIT_ID -> commitSelector.value();
            case BRANCH_ID -> headOf(read(uri("projects/" + projectId + "/branches/" + commitSelector.value()),
                    Branch.class));
            case BRANCH_NAME -> headOf(findBranch(projectId, commitSelector.value()));
            case DEFAULT_BRANCH -> headOf(defaultBranch(matched != null ? matched
                    : read(uri("projects/" + projectId), Project.class)));
        };
        LOG.info("Resolved {} to commit {}", projectSelector, commitId);
        return new ModelReference(projectId, commitId);
    }

    /** The element listing of a commit, optionally with an explicit page size. */
    public URI elementsUri(ModelReference reference, Integer pageSize) {
        String path = "projects/" + reference.projectId() + "/commits/" + reference.commitId() + "/elements";
        if (pageSize != null) {
            path += "?page%5Bsize%5D=" + pageSize;
        }
        return uri(path);
    }

    URI uri(String path) {
        return URI.create(baseUri + "/" + path);
    }

    private Project findProject(String namePrefix) throws FetchException, InterruptedException {
        List<Project> projects = readAll(uri("projects"), Project.class);
        return single(projects, p -> p.name() != null && p.name().startsWith(namePrefix), Project::name,
                "project", namePrefix);
    }

    private Branch findBranch(String projectId, String namePrefix) throws FetchException, InterruptedException {
        List<Branch> branches = readAll(uri("projects/" + projectId + "/branches"), Branch.class);
        return single(branches, b -> b.name() != null && b.name().startsWith(namePrefix), Branch::name,
                "branch", namePrefix);
    }

    private Branch defaultBranch(Project project) throws FetchException, InterruptedException {
        if (project.defaultBranch() == null || project.defaultBranch().id() == null) {
            throw new FetchException(FetchException.Kind.SELECTION,
                    "Project " + project.id() + " has no default branch", null);
        }
        return read(uri("projects/" + project.id() + "/branches/" + project.defaultBranch().id()), Branch.class);
    }

    private static String headOf(Branch branch) throws FetchException {
        if (branch.head() == null || branch.head().id() == null) {
            throw new FetchException(FetchException.Kind.SELECTION,
                    "Branch " + branch.name() + " (" + branch.id() + ") has no commits", null);
        }
        return branch.head().id();
    }

    private static <T> T single(List<T> candidates, Predicate<T> filter,
            Function<T, String> name, String what, String prefix) throws FetchException {
        List<T> matches = candidates.stream().filter(filter).collect(Collectors.toList());
        if (matches.size() == 1) {
            return matches.get(0);
        }
        List<T> shown = matches.isEmpty() ? candidates : matches;
        String names = shown.stream().map(name).collect(Collectors.joining(", "));
        String problem = matches.isEmpty()
                ? "No " + what + " name starts with '" + prefix + "'"
                : matches.size() + " " + what + " names start with '" + prefix + "', be more specific";
        throw new FetchException(FetchException.Kind.SELECTION, problem + ". Available: [" + names + "]", null);
    }

    private <T> T read(URI uri, Class<T> type) throws FetchException, InterruptedException {
        JsonNode document;
        try {
            document = fetcher.fetchDocument(uri);
        } catch (FetchException e) {
            if (e.getStatus() == 404) {
                throw new FetchException(FetchException.Kind.SELECTION,
                        "No " + type.getSimpleName().toLowerCase(Locale.ROOT) + " found at " + uri, uri, 404, e);
            }
            throw e;
        }
        return convert(document, type, uri);
    }

    private <T> List<T> readAll(URI uri, Class<T> type) throws FetchException, InterruptedException {
        List<T> values = new ArrayList<>();
        for (JsonNode node : fetcher.fetchAll(uri, PageListener.NONE)) {
            values.add(convert(node, type, uri));
        }
        return values;
    }

    private static <T> T convert(JsonNode node, Class<T> type, URI uri) throws FetchException {
        try {
            return MAPPER.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new FetchException(FetchException.Kind.MALFORMED_RESPONSE,
                    "Unexpected " + type.getSimpleName() + " from " + uri + ": " + e.getOriginalMessage(),
                    uri, -1, e);
        }
    }
}
