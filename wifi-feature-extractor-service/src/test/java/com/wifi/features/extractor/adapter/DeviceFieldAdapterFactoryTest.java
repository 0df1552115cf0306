// wifi-feature-extractor-service/src/test/java/com/wifi/features/extractor/adapter/DeviceFieldAdapterFactoryTest.java

package com.wifi.features.extractor.adapter;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.wifi.features.extractor.adapter.impl.AutoDetectingDeviceFieldAdapter;
import com.wifi.features.extractor.adapter.impl.FlattenedDeviceFieldAdapter;
import com.wifi.features.extractor.adapter.impl.NestedDeviceFieldAdapter;

class DeviceFieldAdapterFactoryTest {

  private final NestedDeviceFieldAdapter nested = new NestedDeviceFieldAdapter();
  private final FlattenedDeviceFieldAdapter flattened = new FlattenedDeviceFieldAdapter();

  @Test
  void shouldReturnAdapterForEachLayout() {
    AutoDetectingDeviceFieldAdapter auto = new AutoDetectingDeviceFieldAdapter(nested, flattened);
    DeviceFieldAdapterFactory factory =
        new DeviceFieldAdapterFactory(List.of(nested, flattened, auto));

    assertThat(factory.getAdapter(FieldLayout.NESTED)).isSameAs(nested);
    assertThat(factory.getAdapter(FieldLayout.FLATTENED)).isSameAs(flattened);
    assertThat(factory.getAdapter(FieldLayout.AUTO)).isSameAs(auto);
  }

  @Test
  void shouldFailForUnregisteredLayout() {
    DeviceFieldAdapterFactory factory = new DeviceFieldAdapterFactory(List.of(nested));

    assertThatThrownBy(() -> factory.getAdapter(FieldLayout.FLATTENED))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void shouldRejectDuplicateLayouts() {
    assertThatThrownBy(
            () -> new DeviceFieldAdapterFactory(List.of(nested, new NestedDeviceFieldAdapter())))
        .isInstanceOf(IllegalStateException.class);
  }
}
