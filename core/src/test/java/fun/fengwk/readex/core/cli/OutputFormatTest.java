package fun.fengwk.readex.core.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class OutputFormatTest {

    @Test
    public void shouldResolveFormat() {
        assertThat(OutputFormat.fromValue(null)).isEqualTo(OutputFormat.HTML);
        assertThat(OutputFormat.fromValue(" ")).isEqualTo(OutputFormat.HTML);
        assertThat(OutputFormat.fromValue("TEXT")).isEqualTo(OutputFormat.TEXT);
        assertThat(OutputFormat.fromValue(" json ")).isEqualTo(OutputFormat.JSON);
        assertThatThrownBy(() -> OutputFormat.fromValue("xml"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("unsupported format: xml");
    }

}
