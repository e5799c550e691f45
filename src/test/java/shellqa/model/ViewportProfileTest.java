package shellqa.model;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ViewportProfileTest {

    @Test
    public void labels() {
        assertThat(ViewportProfile.desktop(1280, 900).label()).isEqualTo("desktop-1280x900");
        assertThat(ViewportProfile.mobile(390, 844)).hasToString("mobile-390x844");
    }

    @Test
    public void deviceClass() {
        assertThat(ViewportProfile.mobile(375, 844).isMobile()).isTrue();
        assertThat(ViewportProfile.desktop(1024, 900).isMobile()).isFalse();
        assertThat(ViewportProfile.desktop(1024, 900)).isEqualTo(new ViewportProfile(1024, 900, DeviceClass.DESKTOP));
    }

    @Test
    public void invalidDimensionsRejected() {
        assertThatThrownBy(() -> ViewportProfile.desktop(0, 900)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ViewportProfile.mobile(390, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ViewportProfile(390, 844, null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void diagnosticRecordFormatting() {
        DiagnosticRecord record = new DiagnosticRecord(DiagnosticRecord.Kind.CONSOLE_ERROR, "Failed to load", "desktop-1440x900");
        assertThat(record.formatted()).isEqualTo("console error: Failed to load");
        assertThat(record).hasToString("console error: Failed to load [desktop-1440x900]");
        assertThat(new DiagnosticRecord(DiagnosticRecord.Kind.PAGE_ERROR, null, "x").formatted()).isEqualTo("page error: ");
    }
}
