package fun.fengwk.readex.core.extract;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulated score of one extracted string and the selectors that produced it.
 *
 * @author fengwk
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedElement {

    private int score;

    private List<String> selectors = new ArrayList<>();

    public void merge(int score, List<String> selectors) {
        this.score += score;
        this.selectors.addAll(selectors);
        this.selectors.sort(null);
    }

}
