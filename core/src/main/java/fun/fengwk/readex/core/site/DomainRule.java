package fun.fengwk.readex.core.site;

import java.util.List;

/**
 * Static edits for one domain and its subdomains.
 *
 * @param hostSuffix registered domain the rule applies to.
 * @param focusSelectors containers marked as forced main-content candidates.
 * @param stripSelectors boilerplate removed before location.
 * @author fengwk
 */
public record DomainRule(String hostSuffix, List<String> focusSelectors, List<String> stripSelectors) {

    public boolean matches(String host) {
        return host.equals(hostSuffix) || host.endsWith("." + hostSuffix);
    }

}
