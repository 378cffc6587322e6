package com.factory.palletizer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "palletizer")
public class PalletizerProperties {

    /**
     * Device id recorded on drums when the scanning station sends none.
     */
    private String deviceId = "web";

    /**
     * Edge length in pixels of the rendered pallet QR label.
     */
    private int labelSize = 300;

    /**
     * Creates a sample material on startup when the material table is empty.
     */
    private boolean seedSampleMaterial;

    private final Security security = new Security();

    public String getDeviceId() {
        return deviceId;
    }

    public void setDeviceId(String deviceId) {
        this.deviceId = deviceId;
    }

    public int getLabelSize() {
        return labelSize;
    }

    public void setLabelSize(int labelSize) {
        this.labelSize = labelSize;
    }

    public boolean isSeedSampleMaterial() {
        return seedSampleMaterial;
    }

    public void setSeedSampleMaterial(boolean seedSampleMaterial) {
        this.seedSampleMaterial = seedSampleMaterial;
    }

    public Security getSecurity() {
        return security;
    }

    public static class Security {

        private String operatorUsername = "operator";

        private String operatorPassword;

        private String adminUsername = "admin";

        private String adminPassword;

        public String getOperatorUsername() {
            return operatorUsername;
        }

        public void setOperatorUsername(String operatorUsername) {
            this.operatorUsername = operatorUsername;
        }

        public String getOperatorPassword() {
            return operatorPassword;
        }

        public void setOperatorPassword(String operatorPassword) {
            this.operatorPassword = operatorPassword;
        }

        public String getAdminUsername() {
            return adminUsername;
        }

        public void setAdminUsername(String adminUsername) {
            this.adminUsername = adminUsername;
        }

        public String getAdminPassword() {
            return adminPassword;
        }

        public void setAdminPassword(String adminPassword) {
            this.adminPassword = adminPassword;
        }
    }
}
