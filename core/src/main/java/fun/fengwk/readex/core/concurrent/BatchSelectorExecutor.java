package fun.fengwk.readex.core.concurrent;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Evaluator;
import org.jsoup.select.QueryParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Applies several selector actions in one document-order traversal.
 * Actions matching the same node run in the iteration order of the given map.
 *
 * @author fengwk
 */
public final class BatchSelectorExecutor {

    private BatchSelectorExecutor() {
    }

    public static void execute(Element root, Map<String, Consumer<Element>> actions) {
        if (root == null || actions == null || actions.isEmpty()) {
            return;
        }
        List<SelectorAction> selectorActions = new ArrayList<>(actions.size());
        for (Map.Entry<String, Consumer<Element>> action : actions.entrySet()) {
            selectorActions.add(new SelectorAction(QueryParser.parse(action.getKey()), action.getValue()));
        }
        Elements elements = root.getAllElements();
        for (Element element : elements) {
            if (element instanceof Document) {
                continue;
            }
            for (SelectorAction selectorAction : selectorActions) {
                if (element.is(selectorAction.evaluator())) {
                    selectorAction.action().accept(element);
                }
            }
        }
    }

    private record SelectorAction(Evaluator evaluator, Consumer<Element> action) {

    }

}
