package uimbt.browser;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import uimbt.accessibility.AriaSnapshotParser;
import uimbt.fingerprint.ElementDescriptors;
import uimbt.model.ElementDescriptor;
import uimbt.model.LocatorStrategy;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ElementResolver}.
 *
 * <p>Verifies the strategy priority order, the accessible-name comparison
 * for role+name lookups and that hidden elements never match.
 */
public class ElementResolverTest {

    private static final By BUTTONS = By.cssSelector(ElementResolver.ROLE_SELECTORS.get("button"));

    @Mock
    private WebDriver driver;

    @Mock
    private WebElement cancel;

    @Mock
    private WebElement save;

    private AutoCloseable mocks;
    private ElementResolver resolver;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        resolver = new ElementResolver(driver);
        when(cancel.isDisplayed()).thenReturn(true);
        when(cancel.getAccessibleName()).thenReturn("Cancel");
        when(save.isDisplayed()).thenReturn(true);
        when(save.getAccessibleName()).thenReturn("Save");
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    // ── Priority ──────────────────────────────────────────────────────────

    @Test(description = "A test id wins over role and name")
    public void testTestIdFirst() {
        when(driver.findElements(By.cssSelector("[data-testid=\"save\"]"))).thenReturn(List.of(save));

        ElementDescriptor d = ElementDescriptor.of("button",
                LocatorStrategy.roleName("button", "Save"), LocatorStrategy.testId("save"));

        assertThat(resolver.resolve(d)).containsSame(save);
        verify(driver, never()).findElements(BUTTONS);
    }

    @Test(description = "Role and name compare the accessible name of each candidate")
    public void testRoleAndName() {
        when(driver.findElements(BUTTONS)).thenReturn(List.of(cancel, save));

        ElementDescriptor d = ElementDescriptor.of("button", LocatorStrategy.roleName("button", "Save"));

        assertThat(resolver.resolve(d)).containsSame(save);
    }

    @Test(description = "An exact name beats an earlier case-insensitive one")
    public void testCaseInsensitiveFallback() {
        WebElement shouting = mock(WebElement.class);
        when(shouting.isDisplayed()).thenReturn(true);
        when(shouting.getAccessibleName()).thenReturn("SAVE");
        when(driver.findElements(BUTTONS)).thenReturn(List.of(shouting, save));

        ElementDescriptor d = ElementDescriptor.of("button", LocatorStrategy.roleName("button", "Save"));
        assertThat(resolver.resolve(d)).containsSame(save);

        when(driver.findElements(BUTTONS)).thenReturn(List.of(cancel, shouting));
        assertThat(resolver.resolve(d)).containsSame(shouting);
    }

    @Test(description = "Hidden elements never match")
    public void testHiddenSkipped() {
        when(save.isDisplayed()).thenReturn(false);
        when(driver.findElements(BUTTONS)).thenReturn(List.of(save));

        ElementDescriptor d = ElementDescriptor.of("button", LocatorStrategy.roleName("button", "Save"));

        assertThat(resolver.resolve(d)).isEmpty();
    }

    @Test(description = "A failed role lookup falls through to visible text")
    public void testFallsThroughToText() {
        when(driver.findElements(By.xpath(ElementResolver.textXpath("Save")))).thenReturn(List.of(save));

        ElementDescriptor d = ElementDescriptor.of("button",
                LocatorStrategy.roleName("button", "Save"), LocatorStrategy.text("Save"));

        assertThat(resolver.resolve(d)).containsSame(save);
        verify(driver).findElements(BUTTONS);
    }

    @Test(description = "Links are found by their href attribute")
    public void testHref() {
        WebElement link = mock(WebElement.class);
        when(link.isDisplayed()).thenReturn(true);
        when(link.getDomAttribute("href")).thenReturn("#!/devices");
        when(driver.findElements(By.cssSelector("a[href]"))).thenReturn(List.of(link));

        ElementDescriptor d = ElementDescriptor.of("link", LocatorStrategy.href("#!/devices"));

        assertThat(resolver.resolve(d)).containsSame(link);
    }

    @Test(description = "A strategy that throws NoSuchElementException is skipped")
    public void testNoSuchElementSkipped() {
        when(driver.findElements(By.name("username"))).thenThrow(new NoSuchElementException("gone"));
        when(driver.findElements(By.xpath(ElementResolver.textXpath("User")))).thenReturn(List.of(save));

        ElementDescriptor d = ElementDescriptor.of("input", LocatorStrategy.name("username"), LocatorStrategy.text("User"));

        assertThat(resolver.resolve(d)).containsSame(save);
    }

    @Test(description = "Empty when every strategy fails")
    public void testAllFail() {
        ElementDescriptor d = ElementDescriptor.of("input",
                LocatorStrategy.roleName("textbox", "Username"), LocatorStrategy.label("Username"),
                LocatorStrategy.placeholder("Username"));

        assertThat(resolver.resolve(d)).isEmpty();
    }

    // ── Unnamed elements ──────────────────────────────────────────────────

    @Test(description = "An unnamed link resolves by href, not to the first link on the page")
    public void testUnnamedLinkResolvesByHref() {
        WebElement overview = mock(WebElement.class);
        when(overview.isDisplayed()).thenReturn(true);
        when(overview.getAccessibleName()).thenReturn("Overview");
        when(overview.getDomAttribute("href")).thenReturn("#!/overview");
        WebElement devicesIcon = mock(WebElement.class);
        when(devicesIcon.isDisplayed()).thenReturn(true);
        when(devicesIcon.getAccessibleName()).thenReturn("");
        when(devicesIcon.getDomAttribute("href")).thenReturn("#!/devices");
        List<WebElement> links = List.of(overview, devicesIcon);
        when(driver.findElements(By.cssSelector(ElementResolver.ROLE_SELECTORS.get("link")))).thenReturn(links);
        when(driver.findElements(By.cssSelector("a[href]"))).thenReturn(links);

        ElementDescriptor d = ElementDescriptors.forNode(new AriaSnapshotParser()
                .parse("- link:\n  - /url: \"#!/devices\"\n").findFirst("link").orElseThrow());

        assertThat(d.strategies()).containsExactly(LocatorStrategy.href("#!/devices"));
        assertThat(resolver.resolve(d)).containsSame(devicesIcon);
    }

    @Test(description = "A stored role-only locator is tried after href even though it ranks higher")
    public void testRoleOnlyTriedLast() {
        WebElement overview = mock(WebElement.class);
        when(overview.isDisplayed()).thenReturn(true);
        when(overview.getDomAttribute("href")).thenReturn("#!/overview");
        WebElement devicesIcon = mock(WebElement.class);
        when(devicesIcon.isDisplayed()).thenReturn(true);
        when(devicesIcon.getDomAttribute("href")).thenReturn("#!/devices");
        List<WebElement> links = List.of(overview, devicesIcon);
        when(driver.findElements(By.cssSelector(ElementResolver.ROLE_SELECTORS.get("link")))).thenReturn(links);
        when(driver.findElements(By.cssSelector("a[href]"))).thenReturn(links);

        ElementDescriptor d = ElementDescriptor.of("link",
                LocatorStrategy.roleName("link", ""), LocatorStrategy.href("#!/devices"));

        assertThat(resolver.resolve(d)).containsSame(devicesIcon);
    }

    @Test(description = "A role-only locator still resolves when it is the only strategy")
    public void testRoleOnlyAlone() {
        when(driver.findElements(BUTTONS)).thenReturn(List.of(cancel, save));

        ElementDescriptor d = ElementDescriptor.of("button", LocatorStrategy.roleName("button", ""));

        assertThat(resolver.resolve(d)).containsSame(cancel);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @Test(description = "Accessible name falls back to aria-label, then text")
    public void testAccessibleNameFallback() {
        WebElement el = mock(WebElement.class);
        when(el.getAccessibleName()).thenThrow(new UnsupportedOperationException("no BiDi"));
        when(el.getDomAttribute("aria-label")).thenReturn(" Close dialog ");
        assertThat(ElementResolver.accessibleName(el)).isEqualTo("Close dialog");

        when(el.getDomAttribute("aria-label")).thenReturn(null);
        when(el.getText()).thenReturn("Close");
        assertThat(ElementResolver.accessibleName(el)).isEqualTo("Close");
    }

    @Test(description = "XPath literals handle both quote kinds")
    public void testXpathLiteral() {
        assertThat(ElementResolver.xpathLiteral("Save")).isEqualTo("'Save'");
        assertThat(ElementResolver.xpathLiteral("It's")).isEqualTo("\"It's\"");
        assertThat(ElementResolver.xpathLiteral("a'b\"c")).isEqualTo("concat('a', \"'\", 'b\"c')");
    }

    @Test(description = "Label lookup covers for-attributes, nested inputs and aria-label")
    public void testLabelXpath() {
        String xpath = ElementResolver.labelXpath("User name");

        assertThat(xpath)
                .contains("//input[@id=//label[normalize-space(.)='User name']/@for]")
                .contains("//label[normalize-space(.)='User name']//input")
                .contains("//*[@aria-label='User name']");
    }
}
