package fun.fengwk.readex.core.extract;

/**
 * A plain text block and the node index of the element it came from, empty when not indexed.
 *
 * @author fengwk
 */
public record TextBlock(String text, String nodeIndex) {

}
