package mirror;

import java.util.List;
import java.util.Map;
import java.util.Set;

// Scoped references found in one document.
// inScope: canonical URL to request location, in document order
// outOfScope: canonical URLs outside the site, never fetched
// filtered: in-scope assets excluded by the asset policy
// malformed: raw references that could not be normalized
// partial: true when the parser gave up part way through
public record ExtractedLinks(
        Map<String, String> inScope,
        Set<String> outOfScope,
        Set<String> filtered,
        List<String> malformed,
        boolean partial
) {
    public static ExtractedLinks empty() {
        return new ExtractedLinks(Map.of(), Set.of(), Set.of(), List.of(), false);
    }
}
