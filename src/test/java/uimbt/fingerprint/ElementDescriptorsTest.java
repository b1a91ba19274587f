package uimbt.fingerprint;

import org.testng.annotations.Test;
import uimbt.accessibility.AriaNode;
import uimbt.accessibility.AriaSnapshotParser;
import uimbt.model.ElementDescriptor;
import uimbt.model.LocatorStrategy;
import uimbt.model.LocatorStrategy.Kind;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ElementDescriptors}.
 */
public class ElementDescriptorsTest {

    private static AriaNode first(String snapshot, String role) {
        return new AriaSnapshotParser().parse(snapshot).findFirst(role).orElseThrow();
    }

    @Test(description = "Links get role/name, text and href strategies in priority order")
    public void testLink() {
        ElementDescriptor d = ElementDescriptors.forNode(first(
                "- navigation:\n  - link \"Devices\":\n    - /url: \"#!/devices\"\n", "link"));

        assertThat(d.elementType()).isEqualTo("link");
        assertThat(d.strategies()).containsExactly(
                LocatorStrategy.roleName("link", "Devices"),
                LocatorStrategy.text("Devices"),
                LocatorStrategy.href("#!/devices"));
    }

    @Test(description = "Inputs get label and placeholder strategies instead of text")
    public void testInput() {
        ElementDescriptor d = ElementDescriptors.forNode(first(
                "- textbox \"Name\" [placeholder=Preset name]\n", "textbox"));

        assertThat(d.elementType()).isEqualTo("input");
        assertThat(d.strategies()).extracting(LocatorStrategy::kind)
                .containsExactly(Kind.ROLE_NAME, Kind.LABEL, Kind.PLACEHOLDER);
    }

    @Test(description = "Unnamed buttons fall back to role only")
    public void testUnnamedButton() {
        ElementDescriptor d = ElementDescriptors.forNode(first("- button\n", "button"));

        assertThat(d.strategies()).containsExactly(LocatorStrategy.roleName("button", ""));
        assertThat(d.primary().describe()).isEqualTo("getByRole('button')");
    }

    @Test(description = "Unnamed links get no role-only locator when they carry an href")
    public void testUnnamedLink() {
        ElementDescriptor d = ElementDescriptors.forNode(first(
                "- link:\n  - /url: \"#!/devices\"\n", "link"));

        assertThat(d.strategies()).containsExactly(LocatorStrategy.href("#!/devices"));
        assertThat(d.strategies()).noneMatch(LocatorStrategy::isRoleOnly);
    }

    @Test(description = "Tabs are links, everything else non-button is an input")
    public void testElementType() {
        assertThat(ElementDescriptors.elementType("button")).isEqualTo("button");
        assertThat(ElementDescriptors.elementType("tab")).isEqualTo("link");
        assertThat(ElementDescriptors.elementType("combobox")).isEqualTo("input");
    }
}
